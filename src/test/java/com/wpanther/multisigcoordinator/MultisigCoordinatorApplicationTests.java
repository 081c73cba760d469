package com.wpanther.multisigcoordinator;

import com.wpanther.multisigcoordinator.controller.HistoryController;
import com.wpanther.multisigcoordinator.controller.ProposalController;
import com.wpanther.multisigcoordinator.controller.WalletController;
import com.wpanther.multisigcoordinator.scheduler.ProposalExpiryScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class MultisigCoordinatorApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(context.getBean(WalletController.class)).isNotNull();
        assertThat(context.getBean(ProposalController.class)).isNotNull();
        assertThat(context.getBean(HistoryController.class)).isNotNull();
        assertThat(context.getBean(ProposalExpiryScheduler.class)).isNotNull();
    }
}
