package nl.nfi.djwordlist.generate.stream;

public final class WorkerException extends RuntimeException {

    private final int shardIndex;

    public WorkerException(final int shardIndex, final String message) {
        super("Worker for shard %d failed: %s".formatted(shardIndex, message));
        this.shardIndex = shardIndex;
    }

    public WorkerException(final int shardIndex, final Throwable cause) {
        super("Worker for shard %d failed: %s".formatted(shardIndex, cause.getMessage()), cause);
        this.shardIndex = shardIndex;
    }

    public int shardIndex() {
        return shardIndex;
    }
}
