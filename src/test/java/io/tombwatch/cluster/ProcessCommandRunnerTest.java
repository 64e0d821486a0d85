package io.tombwatch.cluster;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ProcessCommandRunnerTest {

    @Test
    void missingExecutableIsASpawnFailure() {
        CommandRunner.CommandResult result = new ProcessCommandRunner()
                .run(List.of("tombwatch-no-such-binary-8f3a"), null, 5_000L);

        Assertions.assertFalse(result.ok());
        Assertions.assertFalse(result.timedOut());
        Assertions.assertTrue(result.describeFailure().startsWith("spawn failed"));
    }

    @Test
    void emptyCommandIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new ProcessCommandRunner().run(List.of(), null, 1_000L));
    }

    @Test
    void truncateFlattensAndBoundsOutput() {
        Assertions.assertEquals("a  b", ProcessCommandRunner.truncate(" a\r\nb "));
        Assertions.assertEquals(515, ProcessCommandRunner.truncate("y".repeat(2_000)).length());
        Assertions.assertEquals("", ProcessCommandRunner.truncate(null));
    }
}
