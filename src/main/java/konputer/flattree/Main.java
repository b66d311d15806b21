package konputer.flattree;

import konputer.flattree.utils.TreePrinter;
import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.LongAdder;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        FlatTree<String> tree = new FlatTree<>("root");
        tree.insert(0, "child1");
        tree.insert(0, "child2");
        tree.insert(1, "grand child 0");
        tree.insertAll(1, List.of("grand child 1", "grand child 2"));
        tree.insertAll(2, List.of("grand child 3", "grand child 4"));
        log.info("tree (simple dump): {}", TreePrinter.simple(tree));
        log.info("tree (multimap dump):\n{}", TreePrinter.multiMap(tree));

        tree.remove(1);
        log.info("tree after 'child1' removal:\n{}", TreePrinter.multiMap(tree));

        int count = args.length > 0 ? Integer.parseInt(args[0]) : 1_000_000;
        FlatTree<Long> big = randomTree(count, new Random(42));

        for (ExecutionMode mode : ExecutionMode.values()) {
            LongAdder sum = new LongAdder();
            long start = System.nanoTime();
            big.traverse(0, mode, sum::add);
            long end = System.nanoTime();
            log.info("{} traversal over {} nodes took {} ms (sum {})", mode, count, (end - start) / 1_000_000.0, sum.sum());
        }

        long start = System.nanoTime();
        int kids = big.getNumOfDescendants(1);
        long end = System.nanoTime();
        log.info("counting {} children of node 1 took {} ms", kids, (end - start) / 1_000_000.0);
    }

    // every node hangs under a random earlier node
    static FlatTree<Long> randomTree(int count, Random random) {
        FlatTree<Long> tree = new FlatTree<>(0L);
        tree.reserve(count);
        Seq.range(1, count).forEach(i -> tree.insert(random.nextInt(i), i.longValue()));
        return tree;
    }
}
