package io.doers.escrow.scheduler;

import io.doers.escrow.config.EscrowProperties;
import io.doers.escrow.notification.OutboxDispatcher;
import org.quartz.CronScheduleBuilder;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.quartz.QuartzJobBean;

/**
 * Quartz wiring for the escrow timers.
 * Auto-confirm every 5 minutes, reminders every 30 minutes, outbox every minute and the
 * referral expiry cleanup daily. Intervals come from doers.escrow.scheduling.
 */
@Configuration
@ConditionalOnProperty(name = "doers.escrow.scheduling.enabled", havingValue = "true", matchIfMissing = false)
public class EscrowJobScheduler {

    private static final Logger log = LoggerFactory.getLogger(EscrowJobScheduler.class);

    private static final String GROUP = "escrowGroup";

    private final EscrowProperties props;

    public EscrowJobScheduler(EscrowProperties props) {
        this.props = props;
    }

    @Bean
    public JobDetail autoConfirmJobDetail() {
        return JobBuilder.newJob(AutoConfirmQuartzJob.class)
            .withIdentity("autoConfirmJob", GROUP)
            .storeDurably()
            .build();
    }

    @Bean
    public Trigger autoConfirmTrigger() {
        return intervalTrigger(autoConfirmJobDetail(), "autoConfirmTrigger",
            props.getScheduling().getAutoConfirmIntervalSeconds());
    }

    @Bean
    public JobDetail confirmationReminderJobDetail() {
        return JobBuilder.newJob(ConfirmationReminderQuartzJob.class)
            .withIdentity("confirmationReminderJob", GROUP)
            .storeDurably()
            .build();
    }

    @Bean
    public Trigger confirmationReminderTrigger() {
        return intervalTrigger(confirmationReminderJobDetail(), "confirmationReminderTrigger",
            props.getScheduling().getReminderIntervalSeconds());
    }

    @Bean
    public JobDetail outboxDispatchJobDetail() {
        return JobBuilder.newJob(OutboxDispatchQuartzJob.class)
            .withIdentity("outboxDispatchJob", GROUP)
            .storeDurably()
            .build();
    }

    @Bean
    public Trigger outboxDispatchTrigger() {
        return intervalTrigger(outboxDispatchJobDetail(), "outboxDispatchTrigger",
            props.getScheduling().getOutboxIntervalSeconds());
    }

    @Bean
    public JobDetail referralExpiryJobDetail() {
        return JobBuilder.newJob(ReferralExpiryQuartzJob.class)
            .withIdentity("referralExpiryJob", GROUP)
            .storeDurably()
            .build();
    }

    @Bean
    public Trigger referralExpiryTrigger() {
        String cronExpression = props.getScheduling().getReferralExpiryCron();
        log.info("Referral expiry scheduled: cron={}", cronExpression);
        return TriggerBuilder.newTrigger()
            .forJob(referralExpiryJobDetail())
            .withIdentity("referralExpiryTrigger", GROUP)
            .withSchedule(CronScheduleBuilder.cronSchedule(cronExpression))
            .build();
    }

    private static Trigger intervalTrigger(JobDetail job, String name, int seconds) {
        log.info("Escrow timer scheduled: trigger={} intervalSeconds={}", name, seconds);
        return TriggerBuilder.newTrigger()
            .forJob(job)
            .withIdentity(name, GROUP)
            .withSchedule(SimpleScheduleBuilder.simpleSchedule()
                .withIntervalInSeconds(seconds)
                .repeatForever()
                .withMisfireHandlingInstructionNextWithRemainingCount())
            .build();
    }

    @DisallowConcurrentExecution
    public static class AutoConfirmQuartzJob extends QuartzJobBean {

        private AutoConfirmationSweeper sweeper;

        @Override
        protected void executeInternal(JobExecutionContext context) throws JobExecutionException {
            try {
                sweeper.runOnce();
            } catch (Exception e) {
                log.error("Auto-confirm tick failed", e);
                throw new JobExecutionException("Auto-confirm tick failed", e);
            }
        }

        @Autowired
        public void setSweeper(AutoConfirmationSweeper sweeper) {
            this.sweeper = sweeper;
        }
    }

    @DisallowConcurrentExecution
    public static class ConfirmationReminderQuartzJob extends QuartzJobBean {

        private ConfirmationReminderSweeper sweeper;

        @Override
        protected void executeInternal(JobExecutionContext context) throws JobExecutionException {
            try {
                sweeper.runOnce();
            } catch (Exception e) {
                log.error("Confirmation reminder tick failed", e);
                throw new JobExecutionException("Confirmation reminder tick failed", e);
            }
        }

        @Autowired
        public void setSweeper(ConfirmationReminderSweeper sweeper) {
            this.sweeper = sweeper;
        }
    }

    @DisallowConcurrentExecution
    public static class OutboxDispatchQuartzJob extends QuartzJobBean {

        private OutboxDispatcher dispatcher;

        @Override
        protected void executeInternal(JobExecutionContext context) throws JobExecutionException {
            try {
                dispatcher.dispatchPending();
            } catch (Exception e) {
                log.error("Outbox dispatch tick failed", e);
                throw new JobExecutionException("Outbox dispatch tick failed", e);
            }
        }

        @Autowired
        public void setDispatcher(OutboxDispatcher dispatcher) {
            this.dispatcher = dispatcher;
        }
    }

    @DisallowConcurrentExecution
    public static class ReferralExpiryQuartzJob extends QuartzJobBean {

        private ReferralDiscountExpirySweeper sweeper;

        @Override
        protected void executeInternal(JobExecutionContext context) throws JobExecutionException {
            try {
                sweeper.runOnce();
            } catch (Exception e) {
                log.error("Referral expiry tick failed", e);
                throw new JobExecutionException("Referral expiry tick failed", e);
            }
        }

        @Autowired
        public void setSweeper(ReferralDiscountExpirySweeper sweeper) {
            this.sweeper = sweeper;
        }
    }
}
