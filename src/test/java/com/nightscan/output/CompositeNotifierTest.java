package com.nightscan.output;

import com.nightscan.config.Config;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CompositeNotifierTest {

    @TempDir
    Path tempDir;

    @Test
    void fromConfig_shouldBuildKnownChannelsAndSkipUnknown() {
        Config config = Config.of(tempDir, Map.of("notify.channels", "log, mail, pager"));

        assertEquals(2, CompositeNotifier.fromConfig(config).size());
    }

    @Test
    void fromConfig_shouldFallBackToLogChannel() {
        Config config = Config.of(tempDir, Map.of("notify.channels", "pager"));

        assertEquals(1, CompositeNotifier.fromConfig(config).size());
    }

    @Test
    void sendFailure_shouldReachEveryChannelThenRethrowFirstError() {
        List<String> calls = new ArrayList<>();
        IllegalStateException first = new IllegalStateException("first");
        CompositeNotifier notifier = new CompositeNotifier(List.of(
                new FailingChannel("a", calls, first),
                new FailingChannel("b", calls, new IllegalStateException("second")),
                new FailingChannel("c", calls, null)));

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> notifier.sendFailure("boom", new JSONObject()));

        assertSame(first, thrown);
        assertEquals(List.of("a", "b", "c"), calls);
    }

    static final class FailingChannel implements PipelineNotifier {
        private final String name;
        private final List<String> calls;
        private final RuntimeException failure;

        FailingChannel(String name, List<String> calls, RuntimeException failure) {
            this.name = name;
            this.calls = calls;
            this.failure = failure;
        }

        @Override
        public void sendSuccess(JSONObject progressDocument, Path reportPath) {
            record();
        }

        @Override
        public void sendFailure(String errorMessage, JSONObject progressDocument) {
            record();
        }

        private void record() {
            calls.add(name);
            if (failure != null) {
                throw failure;
            }
        }
    }
}
