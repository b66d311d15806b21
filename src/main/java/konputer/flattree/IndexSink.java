package konputer.flattree;

import org.jspecify.annotations.NonNull;

import java.util.Collection;

/**
 * Output buffer for node indices. Anything that can append an int can receive query results,
 * so callers are not tied to a particular collection type.
 */
@FunctionalInterface
public interface IndexSink {

    void append(int index);

    static IndexSink of(@NonNull Collection<? super Integer> target) {
        if (target == null) {
            throw new IllegalArgumentException("target collection cannot be null");
        }
        return target::add;
    }
}
