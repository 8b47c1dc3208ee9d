package com.szwego.ecommerce.flink.sink;

/**
 * 一次 stage → merge 的结果
 */
public class SinkResult {

    private final long batchId;
    private final int stagedRows;
    private final int insertedRows;

    public SinkResult(long batchId, int stagedRows, int insertedRows) {
        this.batchId = batchId;
        this.stagedRows = stagedRows;
        this.insertedRows = insertedRows;
    }

    public long getBatchId() { return batchId; }
    public int getStagedRows() { return stagedRows; }
    public int getInsertedRows() { return insertedRows; }

    /** 目标表中已存在 (之前的尝试或重投已写入) 而被跳过的行 */
    public int getAlreadyPresentRows() {
        return stagedRows - insertedRows;
    }

    @Override
    public String toString() {
        return "SinkResult{batchId=" + batchId + ", staged=" + stagedRows
            + ", inserted=" + insertedRows + ", alreadyPresent=" + getAlreadyPresentRows() + "}";
    }
}
