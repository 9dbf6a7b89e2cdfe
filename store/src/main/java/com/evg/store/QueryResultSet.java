package com.evg.store;

import java.util.List;

public final class QueryResultSet {
    private final List<QueryHit> hits;
    private final int shardsScanned;
    private final int segmentsDecrypted;

    public QueryResultSet(List<QueryHit> hits, int shardsScanned, int segmentsDecrypted) {
        this.hits = List.copyOf(hits);
        this.shardsScanned = shardsScanned;
        this.segmentsDecrypted = segmentsDecrypted;
    }

    public List<QueryHit> getHits() { return hits; }
    public int getShardsScanned() { return shardsScanned; }
    public int getSegmentsDecrypted() { return segmentsDecrypted; }

    public int size() {
        return hits.size();
    }

    @Override
    public String toString() {
        return String.format("QueryResultSet{hits=%d, shards=%d, decrypted=%d}", hits.size(), shardsScanned, segmentsDecrypted);
    }
}
