package omni.sync.app.repository;

import java.sql.Statement;

final class BatchCounts {

    private BatchCounts() {
    }

    /**
     * Sums JDBC batch update counts. SUCCESS_NO_INFO counts as one row.
     */
    static int sum(int[][] counts) {
        int total = 0;
        for (int[] batch : counts) {
            for (int count : batch) {
                if (count == Statement.SUCCESS_NO_INFO) {
                    total++;
                } else if (count > 0) {
                    total += count;
                }
            }
        }
        return total;
    }
}
