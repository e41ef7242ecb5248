package eu.virtualparadox.companion.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * CPU session options; one core is left free for request handling.
     */
    public static OrtSession.SessionOptions initializeOrt() throws OrtException {
        final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

        final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        opts.setIntraOpNumThreads(intraThreads);
        opts.setInterOpNumThreads(1);

        log.info("ONNX intra-op threads: {}, inter-op threads: {}", intraThreads, 1);
        return opts;
    }
}
