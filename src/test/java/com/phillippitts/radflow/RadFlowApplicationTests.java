package com.phillippitts.radflow;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.service.queue.ActionQueue;
import com.phillippitts.radflow.service.queue.ActionDispatcher;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@ActiveProfiles("test")
@SpringBootTest
class RadFlowApplicationTests {

    @Autowired
    private ActionQueue queue;

    @Autowired
    private ActionDispatcher dispatcher;

    @Test
    void contextLoads() {
        assertThat(queue.isRunning()).isTrue();
    }

    @Test
    void everyActionKindHasAHandler() {
        assertThat(Arrays.stream(ActionKind.values()).filter(dispatcher::supports))
                .containsExactlyInAnyOrder(ActionKind.values());
    }
}
