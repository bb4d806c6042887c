package nl.nfi.djwordlist.generate.config;

public enum ExecutionMode {

    // workers are threads sharing the budget counter and the sink
    THREADS,
    // workers are child processes, each with a fixed quota
    PROCESSES
}
