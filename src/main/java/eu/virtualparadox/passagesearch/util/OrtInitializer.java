package eu.virtualparadox.passagesearch.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Creates session options with a fixed intra-op thread count.
     *
     * @param intraOpThreads requested intra-op threads; {@code <= 0} means all cores but one
     */
    public static OrtSession.SessionOptions initializeOrt(final int intraOpThreads) {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            final int intraThreads = intraOpThreads > 0
                    ? intraOpThreads
                    : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);

            log.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
            return opts;
        } catch (OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
