package io.doers.escrow.api;

import io.doers.escrow.contract.ContractLifecycleService;
import io.doers.escrow.contract.TransitionResult;
import io.doers.escrow.model.Contract;
import io.doers.escrow.model.ContractEvent;
import io.doers.escrow.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/contracts")
public class ContractController {

	private static final Logger log = LoggerFactory.getLogger(ContractController.class);

	private final ContractLifecycleService lifecycle;

	public ContractController(ContractLifecycleService lifecycle) {
		this.lifecycle = lifecycle;
	}

	// POST /api/contracts/jobs/{jobId}  {"workers": [...], "percentages": [...]}
	@PostMapping("/jobs/{jobId}")
	public ResponseEntity<Map<String, Object>> createForJob(@PathVariable String jobId,
			@RequestBody Map<String, Object> request) {
		try {
			UUID job = ApiResponses.parseUuid(jobId, "jobId");
			List<UUID> workers = new ArrayList<>();
			Object rawWorkers = request.get("workers");
			if (!(rawWorkers instanceof List)) {
				return ApiResponses.badRequest("workers must be a list of user ids");
			}
			for (Object w : (List<?>) rawWorkers) {
				workers.add(ApiResponses.parseUuid(String.valueOf(w), "workers"));
			}
			List<BigDecimal> percentages = null;
			Object rawPercentages = request.get("percentages");
			if (rawPercentages instanceof List) {
				percentages = new ArrayList<>();
				for (Object p : (List<?>) rawPercentages) {
					percentages.add(new BigDecimal(String.valueOf(p)));
				}
			}

			List<Contract> created = lifecycle.createContractsForJob(job, workers, percentages);
			return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("jobId", jobId, "contracts", created));
		} catch (NumberFormatException e) {
			return ApiResponses.badRequest("percentages must be numbers");
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "create-contracts", e);
		}
	}

	@GetMapping("/jobs/{jobId}")
	public ResponseEntity<Map<String, Object>> listForJob(@PathVariable String jobId) {
		try {
			UUID job = ApiResponses.parseUuid(jobId, "jobId");
			return ResponseEntity.ok(Map.of("jobId", jobId, "contracts", lifecycle.contractsForJob(job)));
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "list-contracts", e);
		}
	}

	@GetMapping("/{contractId}")
	public ResponseEntity<Map<String, Object>> get(@PathVariable String contractId) {
		try {
			Contract contract = lifecycle.getContract(ApiResponses.parseUuid(contractId, "contractId"));
			return ResponseEntity.ok(Map.of("contract", contract));
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "get-contract", e);
		}
	}

	/**
	 * Apply a party event.
	 * POST /api/contracts/{contractId}/events  {"event": "client_confirm", "reason": "..."}
	 */
	@PostMapping("/{contractId}/events")
	public ResponseEntity<Map<String, Object>> advance(@PathVariable String contractId,
			@RequestHeader(name = ApiResponses.USER_HEADER, required = false) String userHeader,
			@RequestBody Map<String, String> request) {
		LoggingUtils.setCorrelationId(LoggingUtils.generateCorrelationId());
		try {
			ContractEvent event = ContractEvent.fromCode(request.get("event"));
			if (event == null) {
				return ApiResponses.badRequest("unknown event: " + request.get("event"));
			}
			UUID id = ApiResponses.parseUuid(contractId, "contractId");
			UUID actor = ApiResponses.actor(userHeader);

			TransitionResult result = lifecycle.advanceContract(id, event, actor, request.get("reason"));

			Map<String, Object> resp = new LinkedHashMap<>();
			resp.put("contractId", contractId);
			resp.put("event", event.getCode());
			resp.put("accepted", result.isAccepted());
			resp.put("status", result.getStatus() != null ? result.getStatus().getCode() : null);
			if (!result.isAccepted()) {
				resp.put("reason", result.getRejectionReason());
				return ResponseEntity.status(HttpStatus.CONFLICT).body(resp);
			}
			return ResponseEntity.ok(resp);
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "advance-contract", e);
		} finally {
			LoggingUtils.clearContext();
		}
	}
}
