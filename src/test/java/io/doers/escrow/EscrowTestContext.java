package io.doers.escrow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.doers.escrow.allocation.AllocationService;
import io.doers.escrow.allocation.AllocationSplitter;
import io.doers.escrow.audit.AuditService;
import io.doers.escrow.commission.CommissionCalculator;
import io.doers.escrow.commission.CommissionService;
import io.doers.escrow.config.EscrowProperties;
import io.doers.escrow.contract.ContractLifecycleService;
import io.doers.escrow.contract.RefundOnCancellationPolicy;
import io.doers.escrow.dlq.DeadLetterQueueService;
import io.doers.escrow.escrow.EscrowLedgerService;
import io.doers.escrow.gateway.GatewayResult;
import io.doers.escrow.gateway.PaymentGatewayClient;
import io.doers.escrow.gateway.PaymentGatewayFactory;
import io.doers.escrow.ledger.BalanceLedgerService;
import io.doers.escrow.metrics.EscrowMetrics;
import io.doers.escrow.model.Contract;
import io.doers.escrow.model.ContractEvent;
import io.doers.escrow.model.Job;
import io.doers.escrow.model.MembershipTier;
import io.doers.escrow.model.Payment;
import io.doers.escrow.model.UserAccount;
import io.doers.escrow.notification.NotificationOutbox;
import io.doers.escrow.repo.BalanceTransactionRepository;
import io.doers.escrow.repo.ContractRepository;
import io.doers.escrow.repo.JobRepository;
import io.doers.escrow.repo.NotificationOutboxRepository;
import io.doers.escrow.repo.PaymentRepository;
import io.doers.escrow.repo.ProcessedGatewayEventRepository;
import io.doers.escrow.repo.UserAccountRepository;
import io.doers.escrow.scheduler.AutoConfirmationSweeper;
import io.doers.escrow.scheduler.ConfirmationReminderSweeper;
import io.doers.escrow.scheduler.ReferralDiscountExpirySweeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.nullable;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

/**
 * Wires the escrow services by hand on an in-memory H2 database in PostgreSQL mode.
 * The payment gateway is a Mockito mock that succeeds unless a test stubs it otherwise.
 */
public class EscrowTestContext implements AutoCloseable {

    public static final Instant T0 = Instant.parse("2026-03-02T12:00:00Z");

    public final MutableClock clock = new MutableClock(T0);
    public final EmbeddedDatabase db;
    public final JdbcTemplate jdbc;
    public final TransactionTemplate tx;
    public final ObjectMapper objectMapper;
    public final EscrowProperties props = new EscrowProperties();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    public final UserAccountRepository users;
    public final JobRepository jobs;
    public final ContractRepository contracts;
    public final PaymentRepository payments;
    public final BalanceTransactionRepository balanceTransactions;
    public final ProcessedGatewayEventRepository processedEvents;
    public final NotificationOutboxRepository outboxRepository;

    public final AuditService audit;
    public final EscrowMetrics metrics;
    public final NotificationOutbox outbox;
    public final DeadLetterQueueService dlq;
    public final CommissionCalculator commissionCalculator;
    public final CommissionService commissionService;
    public final AllocationService allocationService;
    public final BalanceLedgerService balanceLedger;
    public final PaymentGatewayClient gateway;
    public final EscrowLedgerService escrowLedger;
    public final ContractLifecycleService lifecycle;
    public final AutoConfirmationSweeper autoConfirmationSweeper;
    public final ConfirmationReminderSweeper reminderSweeper;
    public final ReferralDiscountExpirySweeper referralExpirySweeper;

    public EscrowTestContext() {
        db = new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .setName("escrow-" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE")
            .addScript("db/escrow-schema.sql")
            .build();
        jdbc = new JdbcTemplate(db);
        tx = new TransactionTemplate(new DataSourceTransactionManager(db));
        objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        users = new UserAccountRepository(jdbc);
        jobs = new JobRepository(jdbc);
        contracts = new ContractRepository(jdbc);
        payments = new PaymentRepository(jdbc);
        balanceTransactions = new BalanceTransactionRepository(jdbc);
        processedEvents = new ProcessedGatewayEventRepository(jdbc);
        outboxRepository = new NotificationOutboxRepository(jdbc);

        audit = new AuditService(jdbc, objectMapper, clock);
        metrics = new EscrowMetrics(meterRegistry, jdbc);
        outbox = new NotificationOutbox(outboxRepository, objectMapper, clock);
        dlq = new DeadLetterQueueService(jdbc, objectMapper, audit, clock);
        commissionCalculator = new CommissionCalculator(props);
        commissionService = new CommissionService(users, commissionCalculator, clock);
        allocationService = new AllocationService(jobs, new AllocationSplitter(), tx);
        balanceLedger = new BalanceLedgerService(balanceTransactions, users, tx, audit, metrics, outbox, clock);

        gateway = mock(PaymentGatewayClient.class);
        lenient().when(gateway.name()).thenReturn("TEST");
        lenient().when(gateway.createOrder(any(), anyString(), anyString()))
            .thenAnswer(inv -> GatewayResult.ok("ORDER-" + UUID.randomUUID(), "CREATED"));
        lenient().when(gateway.captureOrder(anyString()))
            .thenAnswer(inv -> GatewayResult.ok("CAPTURE-" + inv.getArgument(0), "COMPLETED"));
        lenient().when(gateway.refund(anyString(), nullable(BigDecimal.class)))
            .thenAnswer(inv -> GatewayResult.ok("REFUND-" + UUID.randomUUID(), "COMPLETED"));
        PaymentGatewayFactory gatewayFactory = mock(PaymentGatewayFactory.class);
        lenient().when(gatewayFactory.get()).thenReturn(gateway);

        escrowLedger = new EscrowLedgerService(payments, contracts, processedEvents, gatewayFactory, tx, audit,
            metrics, outbox, props, clock);
        lifecycle = new ContractLifecycleService(contracts, jobs, allocationService, commissionService, escrowLedger,
            balanceLedger, new RefundOnCancellationPolicy(escrowLedger, dlq), tx, audit, metrics, outbox, clock);
        autoConfirmationSweeper = new AutoConfirmationSweeper(contracts, lifecycle, dlq, audit, metrics, props, clock);
        reminderSweeper = new ConfirmationReminderSweeper(contracts, lifecycle, outbox, dlq, audit, metrics, clock);
        referralExpirySweeper = new ReferralDiscountExpirySweeper(users, commissionCalculator, outbox, props, clock);
    }

    // ------------------------------------------------------------------
    // Fixtures
    // ------------------------------------------------------------------

    public UserAccount user(MembershipTier tier) {
        UserAccount u = new UserAccount();
        u.setUserId(UUID.randomUUID());
        u.setBalance(BigDecimal.ZERO);
        u.setMembershipTier(tier);
        u.setCurrentCommissionRate(commissionCalculator.tierRate(tier));
        u.setUpdatedOn(clock.instant());
        users.insert(u);
        return u;
    }

    public UserAccount userWithReferralDiscount(Instant expiresAt) {
        UserAccount u = new UserAccount();
        u.setUserId(UUID.randomUUID());
        u.setBalance(BigDecimal.ZERO);
        u.setMembershipTier(MembershipTier.FREE);
        u.setHasReferralDiscount(true);
        u.setReferralDiscountExpiresAt(expiresAt);
        u.setCurrentCommissionRate(props.getCommission().getReferralDiscountRate());
        u.setUpdatedOn(clock.instant());
        users.insert(u);
        return u;
    }

    public Job job(UUID clientId, String price, int maxWorkers, Instant endDate) {
        Job job = new Job();
        job.setJobId(UUID.randomUUID());
        job.setClientId(clientId);
        job.setTitle("Garden cleanup");
        job.setPrice(new BigDecimal(price));
        job.setMaxWorkers(maxWorkers);
        job.setStartDate(clock.instant());
        job.setEndDate(endDate);
        jobs.insert(job);
        return job;
    }

    /**
     * One client, one doer, one contract in pending state.
     */
    public Contract pendingContract(String price) {
        UserAccount client = user(MembershipTier.FREE);
        UserAccount doer = user(MembershipTier.FREE);
        Job job = job(client.getUserId(), price, 1, clock.instant().plus(Duration.ofDays(2)));
        List<Contract> created = lifecycle.createContractsForJob(job.getJobId(), List.of(doer.getUserId()), null);
        return created.get(0);
    }

    /**
     * Pending contract moved to in_progress with its escrow payment captured.
     */
    public Contract inProgressContractWithEscrow(String price) {
        Contract c = pendingContract(price);
        lifecycle.advanceContract(c.getContractId(), ContractEvent.CLIENT_ACCEPT_TERMS, c.getClientId());
        lifecycle.advanceContract(c.getContractId(), ContractEvent.DOER_ACCEPT_TERMS, c.getDoerId());
        Payment payment = escrowLedger.createOrder(c.getContractId());
        escrowLedger.capture(payment.getPaymentId(), "evt-" + payment.getPaymentId());
        lifecycle.advanceContract(c.getContractId(), ContractEvent.START, c.getClientId());
        return contracts.findById(c.getContractId()).orElseThrow();
    }

    public Contract reload(Contract c) {
        return contracts.findById(c.getContractId()).orElseThrow();
    }

    public int outboxCount(UUID userId, String template) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(1) FROM notification_outbox WHERE user_id = ? AND template = ?",
            Integer.class, userId, template);
        return count != null ? count : 0;
    }

    @Override
    public void close() {
        db.shutdown();
    }
}
