package konputer.flattree.dtos;

import org.jspecify.annotations.Nullable;

// snapshot of a single slot, index is only meaningful until the next removal
public record Node<T>(int index, @Nullable T value, int parentIndex) {

    public boolean isRoot() {
        return index == 0;
    }
}
