package com.chaininsights.common.consensus;

import com.chaininsights.common.model.MinerClaim;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Partitions the claims of one network into groups with near-identical coverage.
 *
 * <h3>Model</h3>
 * <pre>
 *   point(claim)   = (startHeight, endHeight)
 *   seeding        = k-means++ driven by {@code new Random(seed)}
 *   iteration      = Lloyd's algorithm, at most {@value #MAX_ITERATIONS} passes
 *   stop condition = no assignment changed
 * </pre>
 *
 * <p>Fewer claims than clusters cannot be partitioned: the result is {@code skipped}.
 * Clusters that end up empty are dropped; the remaining clusters keep the input order of
 * their members.
 *
 * <p>Pure static utility: the same claims, {@code k} and seed always give the same partition.
 */
public final class CoverageClusterer {

    static final int MAX_ITERATIONS = 100;

    private CoverageClusterer() {}

    public static ClusteringResult cluster(List<MinerClaim> claims, int k, long seed) {
        if (k <= 0) {
            return ClusteringResult.skip("cluster count must be positive, was " + k);
        }
        if (claims.size() < k) {
            return ClusteringResult.skip(
                "n_samples=" + claims.size() + " should be >= n_clusters=" + k);
        }

        double[][] points = new double[claims.size()][];
        for (int i = 0; i < claims.size(); i++) {
            points[i] = new double[] {claims.get(i).startHeight(), claims.get(i).endHeight()};
        }

        double[][] centers = seedCenters(points, k, new Random(seed));
        int[] assignment = new int[points.length];
        Arrays.fill(assignment, -1);

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            boolean changed = false;
            for (int i = 0; i < points.length; i++) {
                int nearest = nearestCenter(points[i], centers);
                if (nearest != assignment[i]) {
                    assignment[i] = nearest;
                    changed = true;
                }
            }
            if (!changed) break;
            recomputeCenters(points, assignment, centers);
        }

        List<List<MinerClaim>> clusters = new ArrayList<>();
        for (int c = 0; c < k; c++) {
            List<MinerClaim> members = new ArrayList<>();
            for (int i = 0; i < points.length; i++) {
                if (assignment[i] == c) members.add(claims.get(i));
            }
            if (!members.isEmpty()) clusters.add(members);
        }
        return ClusteringResult.of(clusters);
    }

    // ── k-means++ seeding ────────────────────────────────────────────────────

    static double[][] seedCenters(double[][] points, int k, Random random) {
        double[][] centers = new double[k][];
        centers[0] = points[random.nextInt(points.length)].clone();

        double[] minDistances = new double[points.length];
        for (int c = 1; c < k; c++) {
            double total = 0.0;
            for (int i = 0; i < points.length; i++) {
                double best = Double.MAX_VALUE;
                for (int j = 0; j < c; j++) {
                    best = Math.min(best, squaredDistance(points[i], centers[j]));
                }
                minDistances[i] = best;
                total += best;
            }

            int chosen;
            if (total <= 0.0) {
                // every point already sits on a center
                chosen = random.nextInt(points.length);
            } else {
                double target = random.nextDouble() * total;
                chosen = points.length - 1;
                double cumulative = 0.0;
                for (int i = 0; i < points.length; i++) {
                    cumulative += minDistances[i];
                    if (cumulative >= target) {
                        chosen = i;
                        break;
                    }
                }
            }
            centers[c] = points[chosen].clone();
        }
        return centers;
    }

    private static int nearestCenter(double[] point, double[][] centers) {
        int nearest = 0;
        double best = Double.MAX_VALUE;
        for (int c = 0; c < centers.length; c++) {
            double d = squaredDistance(point, centers[c]);
            if (d < best) {
                best = d;
                nearest = c;
            }
        }
        return nearest;
    }

    private static void recomputeCenters(double[][] points, int[] assignment, double[][] centers) {
        int dims = points[0].length;
        double[][] sums = new double[centers.length][dims];
        int[] counts = new int[centers.length];
        for (int i = 0; i < points.length; i++) {
            counts[assignment[i]]++;
            for (int d = 0; d < dims; d++) {
                sums[assignment[i]][d] += points[i][d];
            }
        }
        for (int c = 0; c < centers.length; c++) {
            if (counts[c] == 0) continue; // empty cluster keeps its previous center
            for (int d = 0; d < dims; d++) {
                centers[c][d] = sums[c][d] / counts[c];
            }
        }
    }

    private static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int d = 0; d < a.length; d++) {
            double diff = a[d] - b[d];
            sum += diff * diff;
        }
        return sum;
    }
}
