package konputer.flattree.utils;

import konputer.flattree.FlatTree;
import konputer.flattree.dtos.Node;
import org.jooq.lambda.Seq;
import org.jspecify.annotations.NonNull;

import java.util.List;

public final class TreePrinter {

    private TreePrinter() {
    }

    // every node as "value {parent}", in slot order
    public static String simple(@NonNull FlatTree<?> tree) {
        return Seq.seq(tree.nodes())
                .map(n -> n.value() + " {" + n.parentIndex() + "}")
                .toString(", ");
    }

    /**
     * One line per distinct parent index, ascending, listing the values of its first generation
     * descendants. The root line never lists children since the root's children cannot be
     * enumerated through {@link FlatTree#getDescendants(int)}.
     */
    public static String multiMap(@NonNull FlatTree<?> tree) {
        List<Integer> parentIds = Seq.seq(tree.nodes())
                .map(Node::parentIndex)
                .distinct()
                .sorted()
                .toUnmodifiableList();

        StringBuilder sb = new StringBuilder();
        for (int p : parentIds) {
            sb.append(tree.get(p)).append(": ");
            sb.append(Seq.seq(tree.getDescendants(p))
                    .map(tree::get)
                    .toString(","));
            sb.append('\n');
        }
        return sb.toString();
    }
}
