package io.doers.escrow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "doers.escrow")
public class EscrowProperties {
	private String currency = "ARS";

	private Commission commission = new Commission();
	private Scheduling scheduling = new Scheduling();
	private Gateway gateway = new Gateway();
	private Outbox outbox = new Outbox();
	private int dlqWarningThreshold = 100;

	public String getCurrency() {
		return currency;
	}

	public void setCurrency(String currency) {
		this.currency = currency;
	}

	public Commission getCommission() {
		return commission;
	}

	public void setCommission(Commission commission) {
		this.commission = commission;
	}

	public Scheduling getScheduling() {
		return scheduling;
	}

	public void setScheduling(Scheduling scheduling) {
		this.scheduling = scheduling;
	}

	public Gateway getGateway() {
		return gateway;
	}

	public void setGateway(Gateway gateway) {
		this.gateway = gateway;
	}

	public Outbox getOutbox() {
		return outbox;
	}

	public void setOutbox(Outbox outbox) {
		this.outbox = outbox;
	}

	public int getDlqWarningThreshold() {
		return dlqWarningThreshold;
	}

	public void setDlqWarningThreshold(int dlqWarningThreshold) {
		this.dlqWarningThreshold = dlqWarningThreshold;
	}

	/**
	 * Commission rates in percent.
	 */
	public static class Commission {
		private BigDecimal freeRate = new BigDecimal("8");
		private BigDecimal proRate = new BigDecimal("3");
		private BigDecimal superProRate = new BigDecimal("2");
		private BigDecimal familyPlanRate = BigDecimal.ZERO;
		private BigDecimal referralDiscountRate = new BigDecimal("3");

		public BigDecimal getFreeRate() {
			return freeRate;
		}

		public void setFreeRate(BigDecimal freeRate) {
			this.freeRate = freeRate;
		}

		public BigDecimal getProRate() {
			return proRate;
		}

		public void setProRate(BigDecimal proRate) {
			this.proRate = proRate;
		}

		public BigDecimal getSuperProRate() {
			return superProRate;
		}

		public void setSuperProRate(BigDecimal superProRate) {
			this.superProRate = superProRate;
		}

		public BigDecimal getFamilyPlanRate() {
			return familyPlanRate;
		}

		public void setFamilyPlanRate(BigDecimal familyPlanRate) {
			this.familyPlanRate = familyPlanRate;
		}

		public BigDecimal getReferralDiscountRate() {
			return referralDiscountRate;
		}

		public void setReferralDiscountRate(BigDecimal referralDiscountRate) {
			this.referralDiscountRate = referralDiscountRate;
		}
	}

	public static class Scheduling {
		private boolean enabled = false;
		private Duration autoConfirmGrace = Duration.ofHours(2);
		private int autoConfirmIntervalSeconds = 300;
		private int reminderIntervalSeconds = 1800;
		private int outboxIntervalSeconds = 60;
		private String referralExpiryCron = "0 0 3 * * ?"; // daily at 3 AM

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public Duration getAutoConfirmGrace() {
			return autoConfirmGrace;
		}

		public void setAutoConfirmGrace(Duration autoConfirmGrace) {
			this.autoConfirmGrace = autoConfirmGrace;
		}

		public int getAutoConfirmIntervalSeconds() {
			return autoConfirmIntervalSeconds;
		}

		public void setAutoConfirmIntervalSeconds(int autoConfirmIntervalSeconds) {
			this.autoConfirmIntervalSeconds = autoConfirmIntervalSeconds;
		}

		public int getReminderIntervalSeconds() {
			return reminderIntervalSeconds;
		}

		public void setReminderIntervalSeconds(int reminderIntervalSeconds) {
			this.reminderIntervalSeconds = reminderIntervalSeconds;
		}

		public int getOutboxIntervalSeconds() {
			return outboxIntervalSeconds;
		}

		public void setOutboxIntervalSeconds(int outboxIntervalSeconds) {
			this.outboxIntervalSeconds = outboxIntervalSeconds;
		}

		public String getReferralExpiryCron() {
			return referralExpiryCron;
		}

		public void setReferralExpiryCron(String referralExpiryCron) {
			this.referralExpiryCron = referralExpiryCron;
		}
	}

	public static class Gateway {
		private String strategy = "NOOP"; // NOOP | HTTP
		private Http http = new Http();

		public String getStrategy() {
			return strategy;
		}

		public void setStrategy(String strategy) {
			this.strategy = strategy;
		}

		public Http getHttp() {
			return http;
		}

		public void setHttp(Http http) {
			this.http = http;
		}

		public static class Http {
			private String baseUrl = "http://localhost:8010";
			private int timeoutMs = 8000;
			private String createOrderPath = "/v2/checkout/orders";
			private String captureOrderPath = "/v2/checkout/orders/{orderId}/capture";
			private String refundPath = "/v2/payments/captures/{captureId}/refund";
			private String healthPath = "/actuator/health";

			public String getBaseUrl() {
				return baseUrl;
			}

			public void setBaseUrl(String baseUrl) {
				this.baseUrl = baseUrl;
			}

			public int getTimeoutMs() {
				return timeoutMs;
			}

			public void setTimeoutMs(int timeoutMs) {
				this.timeoutMs = timeoutMs;
			}

			public String getCreateOrderPath() {
				return createOrderPath;
			}

			public void setCreateOrderPath(String createOrderPath) {
				this.createOrderPath = createOrderPath;
			}

			public String getCaptureOrderPath() {
				return captureOrderPath;
			}

			public void setCaptureOrderPath(String captureOrderPath) {
				this.captureOrderPath = captureOrderPath;
			}

			public String getRefundPath() {
				return refundPath;
			}

			public void setRefundPath(String refundPath) {
				this.refundPath = refundPath;
			}

			public String getHealthPath() {
				return healthPath;
			}

			public void setHealthPath(String healthPath) {
				this.healthPath = healthPath;
			}
		}
	}

	public static class Outbox {
		private int batchSize = 100;
		private int maxAttempts = 5;

		public int getBatchSize() {
			return batchSize;
		}

		public void setBatchSize(int batchSize) {
			this.batchSize = batchSize;
		}

		public int getMaxAttempts() {
			return maxAttempts;
		}

		public void setMaxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
		}
	}
}
