package konputer.flattree;

public enum ExecutionMode {
    // Applies the function on the calling thread, in descendant order
    SEQUENTIAL,

    // Applies the function on the common fork-join pool, no ordering between calls
    PARALLEL,

}
