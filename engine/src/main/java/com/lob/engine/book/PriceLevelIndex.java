package com.lob.engine.book;

import com.lob.protocol.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Price levels for both sides of one book.
 *
 * Data structures, per side:
 *   - an unbalanced binary search tree of {@link Limit} nodes keyed by price, grown by
 *     CAS-linking new leaves; nodes are never removed or rotated
 *   - an {@link IdentifierIndex} price -> Limit so repeat prices skip the tree walk
 *   - the inside pointer: the most aggressive level ever inserted. It does not retreat
 *     when that level empties; {@link #bestLive} recomputes from the tree instead.
 *
 * All operations are lock-free, except that an insert finding the side's level budget
 * taken by in-flight inserts spins until they link or back off. Traversals are weakly consistent: they see every level
 * linked before they started and may or may not see levels linked concurrently.
 */
public final class PriceLevelIndex {

    private static final Logger log = LoggerFactory.getLogger(PriceLevelIndex.class);

    private static final class SideTree {
        final Side side;
        final AtomicReference<Limit> root = new AtomicReference<>();
        final AtomicReference<Limit> inside = new AtomicReference<>();
        // Linked nodes, and slots held by inserts still racing to link theirs
        final AtomicInteger levels = new AtomicInteger();
        final AtomicInteger reserved = new AtomicInteger();
        final IdentifierIndex<Limit> byPrice;

        SideTree(Side side, int priceIndexBuckets, int maxLevels) {
            this.side = side;
            // Doubled: racing registrations of one level each hold an entry reservation briefly
            this.byPrice = new IdentifierIndex<>(side + " price", priceIndexBuckets, 2L * maxLevels);
        }
    }

    private final SideTree bids;
    private final SideTree asks;
    private final int maxLevels;

    public PriceLevelIndex(int priceIndexBuckets, int maxLevelsPerSide) {
        if (maxLevelsPerSide <= 0) throw new IllegalArgumentException("maxLevelsPerSide must be positive");
        this.maxLevels = maxLevelsPerSide;
        this.bids = new SideTree(Side.BUY, priceIndexBuckets, maxLevelsPerSide);
        this.asks = new SideTree(Side.SELL, priceIndexBuckets, maxLevelsPerSide);
    }

    /**
     * Returns the single level for {@code (side, price)}, creating it if needed. Concurrent
     * callers for the same key all receive the same instance, also when that level takes
     * the last slot of the budget.
     *
     * @throws CapacityExceededException if a new level would exceed the per-side budget
     */
    public Limit findOrInsertLimit(Side side, long price) {
        SideTree tree = tree(side);
        Limit cached = tree.byPrice.find(price);
        if (cached != null) return cached;

        boolean full = false;
        while (true) {
            Limit parent = null;
            Limit cur = tree.root.get();
            while (cur != null) {
                if (price == cur.price) {
                    // Linked by another thread that has not registered it yet
                    tree.byPrice.insertIfAbsent(price, cur);
                    return cur;
                }
                parent = cur;
                cur = price < cur.price ? cur.left : cur.right;
            }

            if (full) {
                throw new CapacityExceededException(side + " price levels", maxLevels);
            }
            if (!tryReserveLevel(tree)) {
                // Every slot is linked: one more walk decides. Otherwise an insert still
                // holds a slot and may be linking this very price.
                if (tree.levels.get() >= maxLevels) full = true;
                else Thread.onSpinWait();
                continue;
            }

            Limit node = new Limit(price);
            boolean linked;
            if (parent == null) {
                linked = tree.root.compareAndSet(null, node);
            } else {
                linked = (price < parent.price ? Limit.LEFT : Limit.RIGHT).compareAndSet(parent, null, node);
            }

            if (linked) {
                node.parent = parent;
                tree.levels.incrementAndGet();
                updateInsidePointer(tree, node);
                tree.byPrice.insertIfAbsent(price, node);
                if (log.isDebugEnabled()) log.debug("New {} level {}", side, price);
                return node;
            }
            // Lost the race for this slot; node was never published, so just drop it
            tree.reserved.decrementAndGet();
        }
    }

    /** @return the level at {@code price}, or {@code null} if none has been created */
    public Limit find(Side side, long price) {
        SideTree tree = tree(side);
        Limit cached = tree.byPrice.find(price);
        if (cached != null) return cached;
        Limit cur = tree.root.get();
        while (cur != null && cur.price != price) {
            cur = price < cur.price ? cur.left : cur.right;
        }
        return cur;
    }

    /** Most aggressive level ever inserted on {@code side}; possibly empty. */
    public Limit inside(Side side) {
        return tree(side).inside.get();
    }

    /** Most aggressive level that currently has resting orders, or {@code null}. */
    public Limit bestLive(Side side) {
        Limit inside = inside(side);
        if (inside != null && !inside.isEmpty()) return inside;
        Limit[] found = new Limit[1];
        walk(tree(side), l -> {
            if (!l.isEmpty()) {
                found[0] = l;
                return false;
            }
            return true;
        });
        return found[0];
    }

    /** Visits levels best price first (descending bids, ascending asks), empty ones included. */
    public void forEachLevel(Side side, Consumer<Limit> consumer) {
        walk(tree(side), l -> {
            consumer.accept(l);
            return true;
        });
    }

    /** Like {@link #forEachLevel} but stops as soon as {@code visitor} returns false. */
    public void forEachLevelWhile(Side side, Predicate<Limit> visitor) {
        walk(tree(side), visitor::test);
    }

    /** Levels linked into the tree; in-flight inserts are not counted. */
    public int levelCount(Side side) {
        return tree(side).levels.get();
    }

    /** Longest root-to-leaf path; equals the level count when prices arrive sorted. */
    public int height(Side side) {
        Limit root = tree(side).root.get();
        if (root == null) return 0;
        int height = 0;
        ArrayDeque<Limit> level = new ArrayDeque<>();
        level.add(root);
        while (!level.isEmpty()) {
            height++;
            for (int i = level.size(); i > 0; i--) {
                Limit l = level.poll();
                Limit left = l.left;
                Limit right = l.right;
                if (left != null) level.add(left);
                if (right != null) level.add(right);
            }
        }
        return height;
    }

    private void updateInsidePointer(SideTree tree, Limit candidate) {
        while (true) {
            Limit current = tree.inside.get();
            if (current != null && tree.side.atLeastAsAggressive(current.price, candidate.price)) {
                return;
            }
            if (tree.inside.compareAndSet(current, candidate)) {
                return;
            }
        }
    }

    private boolean tryReserveLevel(SideTree tree) {
        if (tree.reserved.incrementAndGet() > maxLevels) {
            tree.reserved.decrementAndGet();
            return false;
        }
        return true;
    }

    private interface LevelVisitor {
        /** @return false to stop the walk */
        boolean visit(Limit level);
    }

    // Iterative in-order walk; bids go right-to-left so the best price comes first
    private static void walk(SideTree tree, LevelVisitor visitor) {
        boolean descending = tree.side == Side.BUY;
        ArrayDeque<Limit> stack = new ArrayDeque<>();
        Limit cur = tree.root.get();
        while (cur != null || !stack.isEmpty()) {
            while (cur != null) {
                stack.push(cur);
                cur = descending ? cur.right : cur.left;
            }
            Limit l = stack.pop();
            if (!visitor.visit(l)) return;
            cur = descending ? l.left : l.right;
        }
    }

    private SideTree tree(Side side) {
        return side == Side.BUY ? bids : asks;
    }
}
