package com.stablegate.ingestion.listener;

import com.stablegate.domain.ChainType;
import com.stablegate.domain.ListenerHealth;
import com.stablegate.domain.PaymentConfirmation;
import com.stablegate.domain.TokenDescriptor;
import com.stablegate.ingestion.adapter.ChainBlock;
import com.stablegate.ingestion.adapter.ChainClient;
import com.stablegate.ingestion.adapter.ChainTransaction;
import com.stablegate.ingestion.adapter.RpcException;
import com.stablegate.ingestion.adapter.TransactionReceipt;
import com.stablegate.ingestion.decoder.Erc20TransferDecoder;
import com.stablegate.ingestion.decoder.MemoExtractor;
import com.stablegate.ingestion.decoder.MemoNotFoundException;
import com.stablegate.ingestion.decoder.PaymentReference;
import com.stablegate.ingestion.decoder.TokenTransfer;
import com.stablegate.ingestion.decoder.TransferDecoder;
import com.stablegate.ingestion.decoder.TransferNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Polls one chain for Transfer events of the watched tokens into the watched wallet and hands confirmed,
 * memo-carrying transfers to the confirmation handler.
 * <p>
 * Each tick scans at most {@code maxBlocksPerIteration} new blocks. Transfers into the wallet that are short of
 * the confirmation depth, transfers whose receipt is not available yet, and transfers whose handler failed, go to a backlog that is re-checked at the start of every tick, so
 * advancing the block cursor never drops them. A hash is marked processed only after the handler succeeds.
 * <p>
 * Cursor, health and counters are written by the polling thread and read by accessors under a read-write lock.
 * The backlog and the processed set are touched only by the polling thread. A run that was stopped never moves
 * the cursor or the health status, and {@link #start()} is refused until its polling thread has exited.
 */
@Slf4j
public class TransactionListener implements BlockchainListener {

    enum Outcome { PROCESSED, IRRELEVANT, HANDLER_FAILED }

    private final ListenerConfig config;
    private final ChainClient client;
    private final ListenerObserver observer;
    private final TransferDecoder transferDecoder;
    private final MemoExtractor memoExtractor;
    private final Clock clock;
    private final Map<String, TokenDescriptor> tokensByIdentifier = new LinkedHashMap<>();
    private final ProcessedTransactionSet processed;
    private final Map<String, PendingTransfer> backlog = new LinkedHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile PaymentConfirmationHandler handler;
    private ScheduledExecutorService poller;
    private boolean running;
    private long lastProcessedBlock;
    private boolean healthy = true;
    private String connectionStatus = ListenerHealth.STATUS_INITIALIZED;
    private long lastActivityTimestamp;
    private long errorCount;
    private long successfulConfirmations;

    public TransactionListener(ListenerConfig config, PaymentConfirmationHandler handler) {
        this(config, handler, ListenerObserver.NOOP);
    }

    public TransactionListener(ListenerConfig config, PaymentConfirmationHandler handler, ListenerObserver observer) {
        this(config, handler, observer, new Erc20TransferDecoder(), new MemoExtractor(), Clock.systemUTC());
    }

    TransactionListener(ListenerConfig config, PaymentConfirmationHandler handler, ListenerObserver observer,
                        TransferDecoder transferDecoder, MemoExtractor memoExtractor, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.handler = Objects.requireNonNull(handler, "confirmation handler must not be null");
        this.observer = observer != null ? observer : ListenerObserver.NOOP;
        this.transferDecoder = transferDecoder;
        this.memoExtractor = memoExtractor;
        this.clock = clock;
        this.client = config.getClient();
        this.processed = new ProcessedTransactionSet(config.getProcessedCacheSize(), config.getProcessedExpiry());
        for (TokenDescriptor token : config.getTokens().values()) {
            tokensByIdentifier.put(token.identifier(), token);
        }
    }

    /**
     * @throws ListenerStateException if running, or if the polling task of a timed-out stop has not exited yet
     */
    @Override
    public void start() {
        requireStartable();
        long height = client.getCurrentHeight();
        lock.writeLock().lock();
        try {
            requireStartable();
            lastProcessedBlock = height;
            cancelled.set(false);
            running = true;
            poller = Executors.newSingleThreadScheduledExecutor(
                    new CustomizableThreadFactory("listener-" + chainType().name().toLowerCase(Locale.ROOT) + "-"));
            long intervalMs = config.getPollInterval().toMillis();
            poller.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("{} listener started at block {} for wallet {} (tokens {}, poll {}, confirmations {})",
                    chainType(), height, config.getWalletAddress(), getSupportedTokens(),
                    config.getPollInterval(), config.getRequiredConfirmations());
        } finally {
            lock.writeLock().unlock();
        }
        updateHealth(true, ListenerHealth.STATUS_CONNECTED, null);
    }

    private void requireStartable() {
        lock.readLock().lock();
        try {
            if (running) {
                throw new ListenerStateException(chainType() + " listener is already running");
            }
            if (poller != null && !poller.isTerminated()) {
                throw new ListenerStateException(chainType() + " listener polling task from the previous run is still running");
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void stop() {
        ScheduledExecutorService toStop;
        lock.writeLock().lock();
        try {
            if (!running) {
                throw new ListenerStateException(chainType() + " listener is not running");
            }
            cancelled.set(true);
            toStop = poller;
        } finally {
            lock.writeLock().unlock();
        }
        toStop.shutdown();
        boolean exited;
        try {
            exited = toStop.awaitTermination(config.getStopTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markStopped();
            throw new ListenerStateException(chainType() + " listener stop interrupted", e);
        }
        markStopped();
        if (!exited) {
            log.warn("{} listener polling task still running after {}", chainType(), config.getStopTimeout());
            throw new ListenerStopTimeoutException(chainType(), config.getStopTimeout());
        }
        log.info("{} listener stopped at block {}", chainType(), getLastProcessedBlock());
    }

    private void markStopped() {
        lock.writeLock().lock();
        try {
            running = false;
        } finally {
            lock.writeLock().unlock();
        }
        updateHealth(false, ListenerHealth.STATUS_STOPPED, null);
    }

    @Override
    public boolean isRunning() {
        lock.readLock().lock();
        try {
            return running;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ChainType getBlockchainType() {
        return chainType();
    }

    @Override
    public String getWalletAddress() {
        return config.getWalletAddress();
    }

    @Override
    public void setConfirmationHandler(PaymentConfirmationHandler handler) {
        this.handler = Objects.requireNonNull(handler, "confirmation handler must not be null");
    }

    @Override
    public List<String> getSupportedTokens() {
        return List.copyOf(config.getTokens().keySet());
    }

    @Override
    public ListenerHealth getListenerHealth() {
        lock.readLock().lock();
        try {
            return new ListenerHealth(healthy, lastProcessedBlock, lastActivityTimestamp, errorCount,
                    successfulConfirmations, connectionStatus);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Scheduled entry point. Nothing may escape it: an exception thrown out of a fixed-delay task cancels
     * every later tick.
     */
    private void tick() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.error("{} poll tick failed unexpectedly: {}", chainType(), e.getMessage(), e);
            recordFailure(e);
        }
    }

    /**
     * One poll iteration: re-check the backlog, then scan the next block range.
     */
    void pollOnce() {
        long currentHeight;
        try {
            currentHeight = client.getCurrentHeight();
        } catch (RpcException e) {
            recordFailure(e);
            return;
        }
        try {
            recheckBacklog(currentHeight);
            long fromBlock = getLastProcessedBlock() + 1;
            long toBlock = Math.min(currentHeight, fromBlock + config.getMaxBlocksPerIteration() - 1);
            if (fromBlock <= toBlock) {
                for (long n = fromBlock; n <= toBlock; n++) {
                    if (cancelled.get()) {
                        log.debug("{} scan cancelled before block {}", chainType(), n);
                        return;
                    }
                    processBlock(n, currentHeight);
                }
                if (cancelled.get()) {
                    return;
                }
                setLastProcessedBlock(toBlock);
                log.debug("{} processed blocks {}-{} (head {})", chainType(), fromBlock, toBlock, currentHeight);
            }
            if (!cancelled.get()) {
                updateHealth(true, ListenerHealth.STATUS_CONNECTED, null);
            }
        } catch (RpcException e) {
            recordFailure(e);
        }
    }

    private void processBlock(long number, long currentHeight) {
        ChainBlock block = client.getBlockByNumber(number);
        for (ChainTransaction tx : block.transactions()) {
            TokenDescriptor token = tx.to() == null ? null : tokensByIdentifier.get(tx.to().toLowerCase(Locale.ROOT));
            if (token == null || processed.contains(tx.hash()) || backlog.containsKey(tx.hash())) {
                continue;
            }
            TransactionReceipt receipt = client.getTransactionReceipt(tx.hash());
            if (receipt == null) {
                log.debug("{} receipt for {} not yet available, deferring", chainType(), tx.hash());
                backlog.put(tx.hash(), new PendingTransfer(tx, token, number, block.timestamp(), 0));
                continue;
            }
            if (!receipt.successful()) {
                log.debug("{} skipping failed transaction {}", chainType(), tx.hash());
                continue;
            }
            if (!isWatchedTransfer(receipt, token)) {
                continue;
            }
            long confirmations = currentHeight - receipt.blockNumber() + 1;
            if (confirmations < config.getRequiredConfirmations()) {
                backlog.put(tx.hash(), new PendingTransfer(tx, token, receipt.blockNumber(), block.timestamp(), 0));
                notifyDetected(tx.hash(), confirmations);
                continue;
            }
            Outcome outcome = processConfirmed(tx, token, receipt, block.timestamp());
            if (outcome == Outcome.HANDLER_FAILED) {
                deferFailed(new PendingTransfer(tx, token, receipt.blockNumber(), block.timestamp(), 0));
            }
        }
    }

    private void recheckBacklog(long currentHeight) {
        if (backlog.isEmpty()) {
            return;
        }
        for (PendingTransfer pending : new ArrayList<>(backlog.values())) {
            if (cancelled.get()) {
                return;
            }
            String hash = pending.transaction().hash();
            if (processed.contains(hash)) {
                backlog.remove(hash);
                continue;
            }
            TransactionReceipt receipt = client.getTransactionReceipt(hash);
            if (receipt == null) {
                if (currentHeight - pending.blockNumber() + 1 >= config.getRequiredConfirmations()) {
                    log.warn("{} transaction {} has no receipt {} blocks after inclusion, dropping",
                            chainType(), hash, currentHeight - pending.blockNumber() + 1);
                    backlog.remove(hash);
                }
                continue;
            }
            if (!receipt.successful()) {
                log.debug("{} backlog transaction {} failed on chain, dropping", chainType(), hash);
                backlog.remove(hash);
                continue;
            }
            if (!isWatchedTransfer(receipt, pending.token())) {
                backlog.remove(hash);
                continue;
            }
            if (currentHeight - receipt.blockNumber() + 1 < config.getRequiredConfirmations()) {
                continue;
            }
            backlog.remove(hash);
            if (processConfirmed(pending.transaction(), pending.token(), receipt, pending.blockTimestamp())
                    == Outcome.HANDLER_FAILED) {
                deferFailed(pending);
            }
        }
    }

    /**
     * True if the receipt carries a Transfer of {@code token} into the watched wallet.
     */
    private boolean isWatchedTransfer(TransactionReceipt receipt, TokenDescriptor token) {
        try {
            transferDecoder.decode(receipt, token.identifier(), config.getWalletAddress());
            return true;
        } catch (TransferNotFoundException e) {
            log.trace("{} {} is not a transfer to the watched wallet: {}", chainType(), receipt.txHash(), e.getMessage());
            return false;
        }
    }

    private void deferFailed(PendingTransfer pending) {
        PendingTransfer failed = pending.withFailure();
        String hash = failed.transaction().hash();
        if (failed.failedAttempts() >= config.getMaxRetries()) {
            log.error("{} giving up on {} after {} failed confirmation attempts",
                    chainType(), hash, failed.failedAttempts());
            return;
        }
        backlog.put(hash, failed);
    }

    Outcome processConfirmed(ChainTransaction tx, TokenDescriptor token, TransactionReceipt receipt, long blockTimestamp) {
        if (processed.contains(tx.hash())) {
            return Outcome.PROCESSED;
        }
        TokenTransfer transfer;
        try {
            transfer = transferDecoder.decode(receipt, token.identifier(), config.getWalletAddress());
        } catch (TransferNotFoundException e) {
            log.debug("{} {}: {}", chainType(), tx.hash(), e.getMessage());
            return Outcome.IRRELEVANT;
        }
        String paymentId;
        try {
            paymentId = PaymentReference.normalize(memoExtractor.extract(tx.memoData()));
        } catch (MemoNotFoundException e) {
            log.info("{} transfer {} of {} {} has no payment memo ({}), not processed",
                    chainType(), tx.hash(), token.toDecimal(transfer.rawAmount()), token.symbol(), e.getMessage());
            return Outcome.IRRELEVANT;
        }
        if (paymentId.isEmpty()) {
            log.info("{} transfer {} carries an empty payment reference, not processed", chainType(), tx.hash());
            return Outcome.IRRELEVANT;
        }
        PaymentConfirmation confirmation = new PaymentConfirmation(
                paymentId,
                tx.hash(),
                token.toDecimal(transfer.rawAmount()),
                token.symbol(),
                chainType(),
                transfer.from(),
                transfer.to(),
                receipt.blockNumber(),
                blockTimestamp);
        try {
            handler.handle(confirmation);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} confirmation handler interrupted for {}", chainType(), tx.hash());
            return Outcome.HANDLER_FAILED;
        } catch (Exception e) {
            log.error("{} confirmation handler failed for {} (payment {}): {}",
                    chainType(), tx.hash(), paymentId, e.getMessage(), e);
            return Outcome.HANDLER_FAILED;
        }
        processed.mark(tx.hash());
        lock.writeLock().lock();
        try {
            successfulConfirmations++;
            lastActivityTimestamp = clock.instant().getEpochSecond();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("{} payment {} confirmed: {} {} in {} (block {})",
                chainType(), paymentId, confirmation.amount(), token.symbol(), tx.hash(), receipt.blockNumber());
        return Outcome.PROCESSED;
    }

    private void recordFailure(RuntimeException e) {
        if (cancelled.get()) {
            log.debug("{} poll tick failed after stop: {}", chainType(), e.getMessage());
            return;
        }
        lock.writeLock().lock();
        try {
            errorCount++;
        } finally {
            lock.writeLock().unlock();
        }
        log.warn("{} poll tick aborted at block {}: {}", chainType(), getLastProcessedBlock(), e.getMessage());
        updateHealth(false, ListenerHealth.STATUS_RPC_ERROR, e.getMessage());
    }

    private void updateHealth(boolean nowHealthy, String status, String errorMessage) {
        boolean changed;
        ListenerHealth snapshot;
        lock.writeLock().lock();
        try {
            changed = healthy != nowHealthy;
            healthy = nowHealthy;
            connectionStatus = status;
            if (nowHealthy) {
                lastActivityTimestamp = clock.instant().getEpochSecond();
            }
            snapshot = new ListenerHealth(healthy, lastProcessedBlock, lastActivityTimestamp, errorCount,
                    successfulConfirmations, connectionStatus);
        } finally {
            lock.writeLock().unlock();
        }
        if (changed) {
            try {
                observer.onHealthChanged(chainType(), snapshot, errorMessage);
            } catch (RuntimeException e) {
                log.warn("{} health observer failed: {}", chainType(), e.getMessage());
            }
        }
    }

    private void notifyDetected(String txHash, long confirmations) {
        log.debug("{} transaction {} detected with {}/{} confirmations",
                chainType(), txHash, confirmations, config.getRequiredConfirmations());
        try {
            observer.onTransactionDetected(chainType(), txHash, confirmations, config.getRequiredConfirmations());
        } catch (RuntimeException e) {
            log.warn("{} detection observer failed for {}: {}", chainType(), txHash, e.getMessage());
        }
    }

    long getLastProcessedBlock() {
        lock.readLock().lock();
        try {
            return lastProcessedBlock;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void setLastProcessedBlock(long block) {
        lock.writeLock().lock();
        try {
            lastProcessedBlock = block;
        } finally {
            lock.writeLock().unlock();
        }
    }

    int pendingCount() {
        return backlog.size();
    }

    boolean isProcessed(String txHash) {
        return processed.contains(txHash);
    }

    private ChainType chainType() {
        return config.getChainType();
    }
}
