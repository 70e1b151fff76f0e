package net.langexplorer.generate;

import com.google.common.collect.Sets;
import com.google.common.util.concurrent.Uninterruptibles;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.langexplorer.api.grammar.BinarySerializable;
import net.langexplorer.api.grammar.GenerationException;
import net.langexplorer.api.grammar.GrammarException;
import net.langexplorer.api.grammar.InvalidGrammarException;
import net.langexplorer.api.grammar.NoValidExpansionException;
import net.langexplorer.expanders.Expander;
import net.langexplorer.expanders.ExpanderFactory;
import net.langexplorer.util.grammar.Grammar;
import net.langexplorer.util.grammar.ProgramInstance;

/**
 * Generates batches of distinct programs on a pool of worker threads.
 * Every worker owns its expander (seeded seed + 5 * index); results flow
 * back to the calling thread through a bounded queue.
 */
public class BatchGenerator<T extends BinarySerializable, I> {

    private static final Logger LOGGER = Logger.getLogger("BatchGenerator");

    public static final long SEED_STRIDE = 5;

    private static final class Message {

        private final ProgramResult result;

        public Message(ProgramResult result) {
            this.result = result;
        }

        public ProgramResult getResult() {
            return result;
        }

        public boolean isEnd() {
            return (result == null);
        }

    }

    private static final Message END = new Message(null);

    private static final long END_RETRY_MS = 10;

    private class Worker implements Runnable {

        private final int index;
        private final int share;
        private final Expander<T, I> expander;

        public Worker(int index, int share, Expander<T, I> expander) {
            this.index = index;
            this.share = share;
            this.expander = expander;
        }

        public void run() {
            try {
                produce();
            } catch (GrammarException exc) {
                fail(exc);
            } catch (InterruptedException exc) {
                Thread.currentThread().interrupt();
                fail(new GenerationException("Worker " + index +
                    " interrupted", exc));
            } catch (RuntimeException exc) {
                LOGGER.log(Level.SEVERE, "Worker " + index + " failed:",
                           exc);
                fail(new GenerationException("Worker " + index +
                    " failed", exc));
            } catch (StackOverflowError exc) {
                fail(new GenerationException("Derivation too deep in " +
                    "worker " + index, exc));
            } finally {
                signalEnd();
            }
        }

        private void signalEnd() {
            while (! queue.offer(END)) {
                if (! collecting.get()) return;
                Uninterruptibles.sleepUninterruptibly(END_RETRY_MS,
                    TimeUnit.MILLISECONDS);
            }
        }

        private void produce() throws GrammarException, InterruptedException {
            int produced = 0;
            long attempts = 0;
            while (produced < share && ! aborted.get()) {
                if (maxAttempts > 0 && attempts >= maxAttempts) {
                    LOGGER.warning("Worker " + index + " gave up after " +
                        attempts + " attempts with " + produced + " of " +
                        share + " programs");
                    break;
                }
                attempts++;
                ProgramInstance<T, I> program;
                try {
                    program = grammar.generate(expander);
                } catch (NoValidExpansionException exc) {
                    LOGGER.log(Level.WARNING, "Worker " + index +
                               " skipped a stuck derivation:", exc);
                    expander.abandon();
                    continue;
                }
                String key = program.toString();
                if (! seen.contains(key)) {
                    seen.add(key);
                    queue.put(new Message(ProgramResult.fromProgram(program,
                        config, true)));
                    produced++;
                    if (config.isReturnPartials()) producePartials(program);
                }
                expander.cleanup();
            }
            LOGGER.fine("Worker " + index + " finished with " + produced +
                        " programs after " + attempts + " attempts");
        }

        private void producePartials(ProgramInstance<T, I> program)
                throws InterruptedException {
            List<ProgramInstance<T, I>> nodes = program.getAllNodes();
            for (ProgramInstance<T, I> node : nodes.subList(1, nodes.size())) {
                String key = node.toString();
                if (seenPartials.contains(key)) continue;
                seenPartials.add(key);
                queue.put(new Message(ProgramResult.fromProgram(node,
                    config, false)));
            }
        }

    }

    private final Grammar<T, I> grammar;
    private final GenerationConfig config;
    private final long maxAttempts;
    private final Set<String> seen;
    private final Set<String> seenPartials;
    private final AtomicBoolean aborted;
    private final AtomicBoolean collecting;
    private final AtomicReference<GrammarException> failure;
    private BlockingQueue<Message> queue;

    public BatchGenerator(Grammar<T, I> grammar, GenerationConfig config) {
        if (grammar == null)
            throw new NullPointerException(
                "BatchGenerator grammar may not be null");
        if (config == null)
            throw new NullPointerException(
                "BatchGenerator config may not be null");
        this.grammar = grammar;
        this.config = config;
        this.maxAttempts = config.getMaxAttempts();
        this.seen = Sets.newConcurrentHashSet();
        this.seenPartials = Sets.newConcurrentHashSet();
        this.aborted = new AtomicBoolean();
        this.collecting = new AtomicBoolean();
        this.failure = new AtomicReference<GrammarException>();
    }

    public Grammar<T, I> getGrammar() {
        return grammar;
    }

    public GenerationConfig getConfig() {
        return config;
    }

    private void fail(GrammarException exc) {
        failure.compareAndSet(null, exc);
        aborted.set(true);
    }

    /**
     * The number of programs worker index of workers is responsible for.
     */
    public static int shareOf(int count, int workers, int index) {
        return count / workers + ((index < count % workers) ? 1 : 0);
    }

    /**
     * Run the batch and collect its results.
     * An invalid grammar aborts the batch and is rethrown once all workers
     * have stopped; other worker failures are reported as
     * GenerationException.
     */
    public synchronized GenerationOutput run(ExpanderFactory<T, I> factory)
            throws InvalidGrammarException, GenerationException {
        int count = config.getCount();
        int workers = config.getWorkers();
        seen.clear();
        seenPartials.clear();
        aborted.set(false);
        collecting.set(true);
        failure.set(null);
        queue = new ArrayBlockingQueue<Message>(Math.max(1, count / workers));
        LOGGER.info("Generating " + count + " programs from " +
            grammar.getName() + " using " + workers + " workers");

        List<Worker> jobs = new ArrayList<Worker>(workers);
        for (int i = 0; i < workers; i++) {
            jobs.add(new Worker(i, shareOf(count, workers, i),
                factory.create(grammar, config.getSeed() + i * SEED_STRIDE)));
        }
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        List<ProgramResult> results = new ArrayList<ProgramResult>();
        try {
            for (Worker w : jobs) pool.execute(w);
            int finished = 0;
            while (finished < workers) {
                Message msg = queue.take();
                if (msg.isEnd()) {
                    finished++;
                } else {
                    results.add(msg.getResult());
                }
            }
        } catch (InterruptedException exc) {
            aborted.set(true);
            collecting.set(false);
            pool.shutdownNow();
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted while collecting " +
                                          "programs", exc);
        } finally {
            collecting.set(false);
            pool.shutdown();
        }

        GrammarException exc = failure.get();
        if (exc instanceof InvalidGrammarException) {
            throw (InvalidGrammarException) exc;
        } else if (exc instanceof GenerationException) {
            throw (GenerationException) exc;
        } else if (exc != null) {
            throw new GenerationException(exc);
        }
        LOGGER.info("Generated " + results.size() + " results from " +
                    grammar.getName());
        String bnf = config.isReturnGrammar() ? grammar.toBNF() : null;
        return new GenerationOutput(grammar.getName(), bnf, results, config);
    }

    public static <T extends BinarySerializable, I> GenerationOutput generate(
            Grammar<T, I> grammar, ExpanderFactory<T, I> factory,
            GenerationConfig config)
            throws InvalidGrammarException, GenerationException {
        return new BatchGenerator<T, I>(grammar, config).run(factory);
    }

}
