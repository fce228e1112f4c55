package com.anomaly.detection.engine.isolationforest;

import com.anomaly.detection.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationTreeTest {

    @Test
    void averagePathLength_smallSizes_matchDefinition() {
        assertThat(IsolationNode.averagePathLength(0)).isEqualTo(0.0);
        assertThat(IsolationNode.averagePathLength(1)).isEqualTo(0.0);
        assertThat(IsolationNode.averagePathLength(2)).isEqualTo(1.0);
    }

    @Test
    void averagePathLength_256_isAboutTenPointTwo() {
        assertThat(IsolationNode.averagePathLength(256)).isCloseTo(10.2448, within(1e-3));
    }

    @Test
    void build_emptyData_throws() {
        assertThatThrownBy(() -> IsolationTree.build(new double[0][], 10, new Random(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pathLength_depthZero_rootLeafCarriesFullCorrection() {
        double[][] data = TestDataFactory.gaussianCluster(3, 64, new double[]{0, 0}, 1.0);
        IsolationTree tree = IsolationTree.build(data, 0, new Random(3));

        assertThat(tree.getRoot().isLeaf()).isTrue();
        assertThat(tree.pathLength(new double[]{0, 0})).isCloseTo(IsolationNode.averagePathLength(64), within(1e-12));
    }

    @Test
    void pathLength_singlePoint_isZero() {
        IsolationTree tree = IsolationTree.build(new double[][]{{1.0, 2.0}}, 10, new Random(5));

        assertThat(tree.pathLength(new double[]{1.0, 2.0})).isEqualTo(0.0);
    }

    @Test
    void build_internalNodes_recordSampleSizeAndRespectDepthLimit() {
        double[][] data = TestDataFactory.gaussianCluster(11, 128, new double[]{5, 5, 5}, 2.0);
        IsolationTree tree = IsolationTree.build(data, 4, new Random(11));

        assertThat(tree.getRoot().getSize()).isEqualTo(128);
        assertThat(maxDepth(tree.getRoot())).isLessThanOrEqualTo(4);
    }

    private static int maxDepth(IsolationNode node) {
        if (node == null || node.isLeaf()) return 0;
        return 1 + Math.max(maxDepth(node.getLeft()), maxDepth(node.getRight()));
    }

    @Test
    void forest_scoresStayInUnitInterval() {
        double[][] data = TestDataFactory.gaussianCluster(7, 300, new double[]{10, -3}, 1.5);
        IsolationForest forest = IsolationForest.train(data, 50, 128, 10, new Random(7));

        assertThat(forest.getSampleSize()).isEqualTo(128);
        assertThat(forest.getTrees()).hasSize(50);
        for (double[] query : new double[][]{{10, -3}, {1000, 1000}, {-50, 20}, data[0]}) {
            assertThat(forest.anomalyScore(query)).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        }
    }

    @Test
    void forest_singlePointSample_reportsUninformativeScore() {
        IsolationForest forest = IsolationForest.train(new double[][]{{1.0}}, 5, 256, 10, new Random(1));

        assertThat(forest.getAveragePathLength()).isEqualTo(0.0);
        assertThat(forest.anomalyScore(new double[]{42.0})).isEqualTo(IsolationForest.UNINFORMATIVE_SCORE);
    }

    @Test
    void featureContributions_outlyingFeatureDominates() {
        double[][] data = TestDataFactory.gaussianCluster(13, 256, new double[]{0, 0}, 1.0);
        IsolationForest forest = IsolationForest.train(data, 100, 256, 10, new Random(13));

        double[] contributions = forest.featureContributions(new double[]{0, 40}, new double[]{0, 0});

        assertThat(contributions[1]).isGreaterThan(contributions[0]);
        for (double c : contributions) {
            assertThat(c).isGreaterThanOrEqualTo(0.0);
        }
    }
}
