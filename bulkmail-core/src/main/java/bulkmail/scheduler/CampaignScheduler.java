package bulkmail.scheduler;

import bulkmail.dispatch.CampaignDispatcher;
import bulkmail.model.Campaign;
import bulkmail.state.CampaignStateMachine;
import bulkmail.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic loop that claims due campaigns and hands them to the {@link CampaignDispatcher}.
 *
 * <p>Each tick claims campaigns one at a time until none is due or
 * {@code maxClaimsPerTick} is reached. Several schedulers, in one process or on several
 * nodes, may tick against the same database; the claim guarantees each campaign is taken once.
 *
 * <p>With {@code resumeOnStart} enabled, the first tick after {@link #start()} redispatches
 * every campaign left IN_PROGRESS, which finishes dispatches interrupted by a crash.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 */
public final class CampaignScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(CampaignScheduler.class.getName());

    private final CampaignStateMachine stateMachine;
    private final CampaignDispatcher dispatcher;
    private final Clock clock;
    private final long intervalMs;
    private final int maxClaimsPerTick;
    private final boolean resumeOnStart;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> tickTask;
    private volatile boolean recoveryPending;
    private volatile boolean closed;

    private CampaignScheduler(Builder builder) {
        this.stateMachine = Objects.requireNonNull(builder.stateMachine, "stateMachine");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.maxClaimsPerTick <= 0) {
            throw new IllegalArgumentException("maxClaimsPerTick must be > 0");
        }
        this.intervalMs = builder.intervalMs;
        this.maxClaimsPerTick = builder.maxClaimsPerTick;
        this.resumeOnStart = builder.resumeOnStart;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the tick schedule. The first tick runs immediately. Subsequent calls are
     * no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("CampaignScheduler has been closed");
        }
        if (tickTask != null) {
            return;
        }
        recoveryPending = resumeOnStart;
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("bulkmail-scheduler-"));
        tickTask = scheduler.scheduleWithFixedDelay(this::tick, 0L, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Executes a single tick. Called automatically by the schedule, but may also be invoked
     * directly for testing. Never throws.
     *
     * @return the number of campaigns claimed by this tick
     */
    public int tick() {
        if (closed) {
            return 0;
        }
        try {
            if (recoveryPending) {
                resumeInProgress();
                recoveryPending = false;
            }
            Instant now = clock.instant();
            int claimed = 0;
            while (claimed < maxClaimsPerTick && !closed) {
                Optional<Campaign> next = stateMachine.claimDue(now);
                if (next.isEmpty()) {
                    break;
                }
                claimed++;
                dispatch(next.get());
            }
            if (claimed == maxClaimsPerTick) {
                logger.info("Claim limit of " + maxClaimsPerTick + " reached; remaining due campaigns wait for the next tick");
            }
            return claimed;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Scheduler tick failed", t);
            return 0;
        }
    }

    private void resumeInProgress() {
        List<Campaign> campaigns = stateMachine.inProgress();
        if (campaigns.isEmpty()) {
            return;
        }
        logger.info("Resuming " + campaigns.size() + " in-progress campaign(s)");
        for (Campaign campaign : campaigns) {
            dispatch(campaign);
        }
    }

    private void dispatch(Campaign campaign) {
        try {
            dispatcher.dispatch(campaign);
        } catch (RuntimeException e) {
            // stays IN_PROGRESS; picked up again by recovery or a manual redispatch
            logger.log(Level.SEVERE, "Failed to dispatch campaign " + campaign.campaignId(), e);
        }
    }

    /**
     * Cancels the tick schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link CampaignScheduler}.
     */
    public static final class Builder {
        private CampaignStateMachine stateMachine;
        private CampaignDispatcher dispatcher;
        private Clock clock;
        private long intervalMs = 60_000;
        private int maxClaimsPerTick = 100;
        private boolean resumeOnStart = true;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         *
         * @param stateMachine the state machine used to claim campaigns
         * @return this builder
         */
        public Builder stateMachine(CampaignStateMachine stateMachine) {
            this.stateMachine = stateMachine;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param dispatcher receives each claimed campaign
         * @return this builder
         */
        public Builder dispatcher(CampaignDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * Sets the clock that decides which campaigns are due.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the delay between the end of one tick and the start of the next.
         *
         * <p>Optional. Defaults to {@code 60000} ms. Must be &gt; 0.
         *
         * @param intervalMs tick interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Optional. Defaults to {@code 100}. Must be &gt; 0.
         *
         * @param maxClaimsPerTick maximum campaigns claimed in one tick
         * @return this builder
         */
        public Builder maxClaimsPerTick(int maxClaimsPerTick) {
            this.maxClaimsPerTick = maxClaimsPerTick;
            return this;
        }

        /**
         * Whether the first tick after {@link CampaignScheduler#start()} redispatches
         * IN_PROGRESS campaigns.
         *
         * <p>Optional. Defaults to {@code true}.
         *
         * @param resumeOnStart whether to resume in-progress campaigns
         * @return this builder
         */
        public Builder resumeOnStart(boolean resumeOnStart) {
            this.resumeOnStart = resumeOnStart;
            return this;
        }

        /**
         * Builds the scheduler. Call {@link CampaignScheduler#start()} to begin ticking.
         *
         * @return a new {@link CampaignScheduler}
         * @throws NullPointerException     if {@code stateMachine} or {@code dispatcher} is null
         * @throws IllegalArgumentException if {@code intervalMs <= 0} or {@code maxClaimsPerTick <= 0}
         */
        public CampaignScheduler build() {
            return new CampaignScheduler(this);
        }
    }
}
