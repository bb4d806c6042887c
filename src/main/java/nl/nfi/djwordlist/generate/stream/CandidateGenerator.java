package nl.nfi.djwordlist.generate.stream;

import java.io.IOException;

public interface CandidateGenerator {

    /**
     * Runs the pipeline until it is exhausted or the budget refuses, writing every accepted candidate as a
     * line to the sink.
     *
     * @return the number of lines written
     */
    long writeCandidates(final Budget budget, final Sink sink, final ProgressReporter progress) throws IOException;
}
