package io.github.yok.mongoclonelink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProgressRecorderTest {

    @Test
    void fail_正常ケース_メッセージなしの例外を記録する_クラス名がERROR行になること() {
        List<String> lines = new ArrayList<>();
        ProgressRecorder recorder = new ProgressRecorder(lines::add);

        recorder.emit("start");
        recorder.fail(new IllegalStateException());

        assertFalse(recorder.isClean());
        assertEquals(List.of("start", "ERROR: IllegalStateException"), lines);
        ReplicationResult result = recorder.toResult();
        assertEquals(ReplicationResult.FAILURE, result.getStatus());
        assertEquals(List.of("IllegalStateException"), result.getFailures());
    }

    @Test
    void recordCount_正常ケース_件数を記録する_結果に順序どおり反映されること() {
        ProgressRecorder recorder = new ProgressRecorder(null);

        recorder.recordCount("b", 2L);
        recorder.recordCount("a", 1L);

        assertTrue(recorder.isClean());
        assertEquals(List.of("b", "a"),
                new ArrayList<>(recorder.toResult().getDocumentCounts().keySet()));
    }
}
