package konputer.flattree;

import com.google.common.collect.Iterators;
import konputer.flattree.dtos.Node;
import konputer.flattree.utils.TreePrinter;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

/**
 * General purpose tree where every node has exactly one parent.
 * <p>
 * Nodes live in two parallel lists, values and parent indices, so the whole node set can be
 * iterated linearly. The root is the node at index 0 and refers to itself as its parent. A tree
 * always has a root.
 * <p>
 * An index is a slot position, not a stable identity: {@link #remove(int)} fills freed slots with
 * the last nodes of the tree, so any index obtained before a removal must be looked up again.
 * <p>
 * Not thread safe. Only the internal parallel scans and {@link ExecutionMode#PARALLEL} traversal
 * run concurrently, over indices collected before dispatch.
 */
public class FlatTree<T> implements Tree<T> {
    private static final Logger log = LoggerFactory.getLogger(FlatTree.class);

    private final ArrayList<T> values;
    private final ArrayList<Integer> parents;
    private final TreeSettings settings;

    public FlatTree(@Nullable T rootValue) {
        this(rootValue, TreeSettings.DEFAULT);
    }

    public FlatTree(@Nullable T rootValue, @NonNull TreeSettings settings) {
        this(new ArrayList<>(), new ArrayList<>(), settings);
        values.add(rootValue);
        parents.add(0);
    }

    private FlatTree(ArrayList<T> values, ArrayList<Integer> parents, TreeSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.values = values;
        this.parents = parents;
        this.settings = settings;
    }

    public static <T> FlatTree<T> fromSequences(@NonNull Collection<? extends T> values,
                                                @NonNull Collection<Integer> parents) {
        return fromSequences(values, parents, TreeSettings.DEFAULT);
    }

    /**
     * Builds a tree from a value list and a parent index list of the same length.
     * Only the lengths and the root convention are checked, the remaining parent indices are
     * trusted to point at nodes of the tree.
     */
    public static <T> FlatTree<T> fromSequences(@NonNull Collection<? extends T> values,
                                                @NonNull Collection<Integer> parents,
                                                @NonNull TreeSettings settings) {
        checkArgument(values.size() == parents.size(),
                "input collections are not of equal size: %s values, %s parents", values.size(), parents.size());
        checkArgument(!values.isEmpty(), "a tree needs at least a root node");

        ArrayList<Integer> parentList = new ArrayList<>(parents.size());
        for (Integer p : parents) {
            parentList.add(Objects.requireNonNull(p, "parent index cannot be null"));
        }
        checkArgument(parentList.get(0) == 0, "root node must be the first node in tree, its parent was %s",
                parentList.get(0));

        return new FlatTree<>(new ArrayList<>(values), parentList, settings);
    }

    public static <T> FlatTree<T> copyOf(@NonNull FlatTree<T> other) {
        return new FlatTree<>(new ArrayList<>(other.values), new ArrayList<>(other.parents), other.settings);
    }

    public TreeSettings settings() {
        return settings;
    }

    // capacity

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public boolean isEmpty() {
        return values.size() == 1;
    }

    @Override
    public void reserve(int capacity) {
        values.ensureCapacity(capacity);
        parents.ensureCapacity(capacity);
    }

    @Override
    public void shrinkToFit() {
        values.trimToSize();
        parents.trimToSize();
    }

    // modifiers

    @Override
    public void clear() {
        T root = values.get(0);
        values.clear();
        parents.clear();
        values.add(root);
        parents.add(0);
    }

    @Override
    public void resize(int count) {
        resize(count, () -> null);
    }

    /**
     * Truncates or extends the tree to {@code count} slots. New slots get a value from
     * {@code filler} and parent index 0, they are not wired into the tree until the caller
     * assigns them a parent.
     */
    @Override
    public void resize(int count, @NonNull Supplier<? extends T> filler) {
        checkArgument(count >= 1, "cannot resize below the root, requested %s", count);
        int len = size();
        if (count < len) {
            values.subList(count, len).clear();
            parents.subList(count, len).clear();
            return;
        }
        reserve(count);
        for (int i = len; i < count; i++) {
            values.add(filler.get());
            parents.add(0);
        }
    }

    @Override
    public boolean insert(int parentId, @Nullable T value) {
        if (!isParentSlot(parentId) || !checkValid("insert")) {
            return false;
        }
        values.add(value);
        parents.add(parentId);
        return true;
    }

    @Override
    public boolean insertAll(int parentId, @NonNull Iterable<? extends T> newValues) {
        if (!isParentSlot(parentId) || !checkValid("insertAll")) {
            return false;
        }
        for (T value : newValues) {
            values.add(value);
            parents.add(parentId);
        }
        return true;
    }

    /**
     * Removes a node and all its descendants.
     * <p>
     * Returns false, leaving the tree untouched, when the node has no descendants: a bare leaf
     * cannot be removed through this call. Removing the root removes every other node but keeps
     * the root itself.
     * <p>
     * Freed slots are filled with the last node of the tree, so surviving nodes may end up at
     * different indices. Parent links are rewritten to follow them.
     */
    @Override
    public boolean remove(int nodeIndex) {
        if (nodeIndex < 0 || nodeIndex >= size() || !checkValid("remove")) {
            return false;
        }

        List<Integer> doomed = new ArrayList<>();
        if (!collectAllDescendants(nodeIndex, doomed::add)) {
            return false;
        }
        if (nodeIndex != 0) {
            doomed.add(nodeIndex);
        }

        int originalSize = size();
        // origin[i] is the pre-removal index of the node currently held in slot i
        int[] origin = IntStream.range(0, originalSize).toArray();

        // highest first, so the last slot never holds a node that is still scheduled for removal
        doomed.sort(Comparator.reverseOrder());
        for (int idx : doomed) {
            swapRemove(idx, origin);
        }

        relink(origin, originalSize);
        log.debug("removed node {} with {} slots, {} nodes left", nodeIndex, doomed.size(), size());
        return true;
    }

    @Override
    public void set(int index, @Nullable T value) {
        checkElementIndex(index, size(), "node index");
        values.set(index, value);
    }

    // queries

    @Override
    public T get(int index) {
        checkElementIndex(index, size(), "node index");
        return values.get(index);
    }

    /**
     * True if any node, the root included, names {@code index} as its parent.
     */
    @Override
    public boolean doesIndexExist(int index) {
        if (settings.parallelFor(size())) {
            return parents.parallelStream().anyMatch(p -> p == index);
        }
        for (int p : parents) {
            if (p == index) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isLeaf(int index) {
        checkElementIndex(index, size(), "node index");
        return getNumOfDescendants(index) == 0;
    }

    // first generation only, the root's reference to itself is not a child
    @Override
    public int getNumOfDescendants(int parentIndex) {
        int len = size();
        if (settings.parallelFor(len)) {
            return (int) IntStream.range(1, len).parallel()
                    .filter(i -> parents.get(i) == parentIndex)
                    .count();
        }
        int count = 0;
        for (int i = 1; i < len; i++) {
            if (parents.get(i) == parentIndex) {
                count++;
            }
        }
        return count;
    }

    /**
     * Appends the first generation descendants of a node, in ascending index order.
     * Not available for the root, use {@link #getAllDescendants(int, IndexSink)} instead.
     *
     * @return true if at least one index was appended
     */
    @Override
    public boolean getDescendants(int parentIndex, @NonNull IndexSink out) {
        if (parentIndex == 0 || !checkValid("getDescendants")) {
            return false;
        }
        boolean found = false;
        for (int i = 1; i < size(); i++) {
            if (parents.get(i) == parentIndex) {
                out.append(i);
                found = true;
            }
        }
        return found;
    }

    @Override
    public List<Integer> getDescendants(int parentIndex) {
        List<Integer> out = new ArrayList<>();
        getDescendants(parentIndex, out::add);
        return out;
    }

    @Override
    public int getParentIndex(int index) {
        checkState(isValid(), "tree structure is invalid");
        checkElementIndex(index, size(), "node index");
        return index > 0 ? parents.get(index) : 0;
    }

    /**
     * Appends every transitive descendant of a node. For the root this is every other index in
     * ascending order. For any other node, generations are listed breadth first, so a node's index
     * always precedes the indices of its own descendants. Beyond that the order is unspecified.
     *
     * @return true if at least one index was appended
     */
    @Override
    public boolean getAllDescendants(int parentIndex, @NonNull IndexSink out) {
        return collectAllDescendants(parentIndex, out);
    }

    @Override
    public List<Integer> getAllDescendants(int parentIndex) {
        List<Integer> out = new ArrayList<>();
        collectAllDescendants(parentIndex, out::add);
        return out;
    }

    // traversal

    @Override
    public boolean traverse(int startIndex, @NonNull ExecutionMode mode, @NonNull Consumer<? super T> fn) {
        List<Integer> descendants = getAllDescendants(startIndex);
        if (descendants.isEmpty()) {
            return false;
        }
        stream(descendants, mode).forEach(i -> fn.accept(values.get(i)));
        return true;
    }

    @Override
    public boolean traverseAndReplace(int startIndex, @NonNull ExecutionMode mode, @NonNull UnaryOperator<T> fn) {
        List<Integer> descendants = getAllDescendants(startIndex);
        if (descendants.isEmpty()) {
            return false;
        }
        // every index is distinct and set() does not change the list structure
        stream(descendants, mode).forEach(i -> values.set(i, fn.apply(values.get(i))));
        return true;
    }

    // iteration

    @Override
    @NonNull
    public Iterator<T> iterator() {
        return Iterators.unmodifiableIterator(values.iterator());
    }

    public List<T> values() {
        return Collections.unmodifiableList(values);
    }

    public Stream<T> stream() {
        return values.stream();
    }

    public Stream<Node<T>> nodes() {
        return IntStream.range(0, size())
                .mapToObj(i -> new Node<>(i, values.get(i), parents.get(i)));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FlatTree<?> &&
                values.equals(((FlatTree<?>) o).values) &&
                parents.equals(((FlatTree<?>) o).parents);
    }

    @Override
    public int hashCode() {
        return 31 * values.hashCode() + parents.hashCode();
    }

    @Override
    public String toString() {
        return TreePrinter.simple(this);
    }

    // internals

    boolean isValid() {
        return values.size() == parents.size() &&
                !parents.isEmpty() &&
                parents.get(0) == 0;
    }

    private boolean checkValid(String operation) {
        if (isValid()) {
            return true;
        }
        log.warn("refusing {} on a structurally invalid tree ({} values, {} parent indices)",
                operation, values.size(), parents.size());
        return false;
    }

    private boolean isParentSlot(int parentId) {
        return parentId >= 0 && parentId < size();
    }

    private boolean collectAllDescendants(int parentIndex, IndexSink out) {
        if (parentIndex == 0) {
            return collectAllFromRoot(out);
        }
        if (!checkValid("getAllDescendants")) {
            return false;
        }
        // worklist instead of recursion, a chain of any depth must not exhaust the stack
        List<Integer> pending = new ArrayList<>();
        pending.add(parentIndex);
        for (int k = 0; k < pending.size(); k++) {
            getDescendants(pending.get(k), i -> {
                pending.add(i);
                out.append(i);
            });
        }
        return pending.size() > 1;
    }

    private boolean collectAllFromRoot(IndexSink out) {
        if (!checkValid("getAllDescendants")) {
            return false;
        }
        int len = size();
        for (int i = 1; i < len; i++) {
            out.append(i);
        }
        return len > 1;
    }

    // root is never removed
    private void swapRemove(int index, int[] origin) {
        if (index == 0) {
            return;
        }
        int last = size() - 1;
        values.set(index, values.get(last));
        parents.set(index, parents.get(last));
        origin[index] = origin[last];
        values.remove(last);
        parents.remove(last);
    }

    private void relink(int[] origin, int originalSize) {
        int[] slotOf = new int[originalSize];
        int len = size();
        for (int i = 0; i < len; i++) {
            slotOf[origin[i]] = i;
        }
        for (int i = 1; i < len; i++) {
            int p = parents.get(i);
            // slots left unwired by resize may point past the tree, keep them as they are
            if (p >= 0 && p < originalSize) {
                parents.set(i, slotOf[p]);
            }
        }
    }

    private Stream<Integer> stream(List<Integer> indices, ExecutionMode mode) {
        if (mode == ExecutionMode.PARALLEL) {
            log.debug("dispatching {} descendants in parallel", indices.size());
            return indices.parallelStream();
        }
        return indices.stream();
    }
}
