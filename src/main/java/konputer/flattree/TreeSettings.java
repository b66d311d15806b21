package konputer.flattree;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tuning knobs for a {@link FlatTree}.
 *
 * @param parallelThreshold node count at or above which linear scans over the parent column run as parallel streams
 */
public record TreeSettings(int parallelThreshold) {
    public static final int DEFAULT_PARALLEL_THRESHOLD = 2_000;
    public static final TreeSettings DEFAULT = new TreeSettings(DEFAULT_PARALLEL_THRESHOLD);

    public TreeSettings {
        checkArgument(parallelThreshold >= 1, "parallelThreshold must be positive, got %s", parallelThreshold);
    }

    public TreeSettings withParallelThreshold(int threshold) {
        return new TreeSettings(threshold);
    }

    boolean parallelFor(int size) {
        return size >= parallelThreshold;
    }
}
