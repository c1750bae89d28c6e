package com.energy.anomaly.engine.isolationforest;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IsolationTreeTest {

    @Test
    void build_constantRows_isSingleLeaf() {
        double[][] rows = {{1.0, 2.0}, {1.0, 2.0}, {1.0, 2.0}, {1.0, 2.0}};

        IsolationTree tree = IsolationTree.build(rows, 8, new Random(1));

        assertThat(tree.getRoot().isExternal()).isTrue();
        assertThat(tree.getRoot().getSize()).isEqualTo(4);
        // Depth 0 plus c(4)
        assertThat(tree.pathLength(new double[]{1.0, 2.0}))
                .isCloseTo(IsolationNode.averagePathLength(4), within(1e-12));
    }

    @Test
    void build_depthCapped_leavesCarryRemainingRows() {
        double[][] rows = new double[16][];
        for (int i = 0; i < rows.length; i++) rows[i] = new double[]{i};

        IsolationTree tree = IsolationTree.build(rows, 1, new Random(3));

        IsolationNode root = tree.getRoot();
        assertThat(root.isExternal()).isFalse();
        assertThat(root.getLeft().isExternal()).isTrue();
        assertThat(root.getRight().isExternal()).isTrue();
        assertThat(root.getLeft().getSize() + root.getRight().getSize()).isEqualTo(16);
    }

    @Test
    void pathLength_pointBeyondRange_isolatedNoDeeperThanTypicalPoint() {
        Random random = new Random(5);
        double[][] rows = new double[64][];
        for (int i = 0; i < rows.length; i++) rows[i] = new double[]{random.nextGaussian()};
        rows[63] = new double[]{12.0};

        double outlier = 0.0;
        double typical = 0.0;
        for (int seed = 0; seed < 50; seed++) {
            IsolationTree tree = IsolationTree.build(rows, 6, new Random(seed));
            outlier += tree.pathLength(new double[]{12.0});
            typical += tree.pathLength(new double[]{0.0});
        }

        assertThat(outlier).isLessThan(typical);
    }
}
