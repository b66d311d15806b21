package konputer.flattree;

import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

public interface Tree<T> extends ReadOnlyTree<T> {

    void set(int index, T value);

    boolean insert(int parentId, T value);

    boolean insertAll(int parentId, Iterable<? extends T> values);

    boolean remove(int nodeIndex);

    void clear();

    void resize(int count);

    void resize(int count, Supplier<? extends T> filler);

    void reserve(int capacity);

    void shrinkToFit();

    boolean traverse(int startIndex, ExecutionMode mode, Consumer<? super T> fn);

    boolean traverseAndReplace(int startIndex, ExecutionMode mode, UnaryOperator<T> fn);
}
