package konputer.flattree;

import java.util.Collection;
import java.util.List;

public interface ReadOnlyTree<T> extends Iterable<T> {

    int size();

    // true if only the root is left
    boolean isEmpty();

    T get(int index);

    boolean doesIndexExist(int index);

    boolean isLeaf(int index);

    int getNumOfDescendants(int parentIndex);

    boolean getDescendants(int parentIndex, IndexSink out);

    default boolean getDescendants(int parentIndex, Collection<? super Integer> out) {
        return getDescendants(parentIndex, IndexSink.of(out));
    }

    List<Integer> getDescendants(int parentIndex);

    int getParentIndex(int index);

    boolean getAllDescendants(int parentIndex, IndexSink out);

    default boolean getAllDescendants(int parentIndex, Collection<? super Integer> out) {
        return getAllDescendants(parentIndex, IndexSink.of(out));
    }

    List<Integer> getAllDescendants(int parentIndex);
}
