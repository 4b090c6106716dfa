package com.anthem.acctctl.gateway.controller;

import com.anthem.acctctl.core.AcctCtlProperties;
import com.anthem.acctctl.core.context.AccountContext;
import com.anthem.acctctl.gateway.model.MutexTestReport;
import com.anthem.acctctl.gateway.service.MutexTestService;
import com.anthem.acctctl.gateway.service.SessionStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import software.amazon.awssdk.core.exception.SdkException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diagnostic endpoints for troubleshooting the gateway identity and the
 * ownership protocol. Only enabled in dev environment for security.
 */
@RestController
@RequestMapping("/actuator/diagnostic")
@RequiredArgsConstructor
@Slf4j
@Profile("dev")
public class DiagnosticController {

    private final SessionStateService session;
    private final MutexTestService mutexTestService;
    private final AcctCtlProperties properties;

    /**
     * Gateway identity, organization and common role.
     */
    @GetMapping("/aws-identity")
    public ResponseEntity<Map<String, Object>> checkAwsIdentity() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("configuredRegion", properties.getAws().getRegion());
        result.put("endpoint", properties.getAws().getEndpoint());
        try {
            AccountContext ctx = session.context();
            result.put("status", "SUCCESS");
            result.put("account", ctx.getIdentity().getAccount());
            result.put("arn", String.valueOf(ctx.getIdentity().getArn()));
            result.put("userId", ctx.getIdentity().getUserId());
            result.put("organization", ctx.getOrg().getId());
            result.put("commonRole", ctx.getCommonRole());
            result.put("owner", ctx.owner());
            log.info("AWS identity check successful: {}", ctx.getIdentity().getArn());
            return ResponseEntity.ok(result);
        } catch (SdkException e) {
            result.put("status", "FAILED");
            result.put("error", e.getMessage());
            result.put("errorType", e.getClass().getSimpleName());
            log.error("AWS identity check failed: {}", e.getMessage());
            return ResponseEntity.status(500).body(result);
        }
    }

    /**
     * Races workers to claim one free account and reports false claims.
     */
    @PostMapping("/mutex-test")
    public ResponseEntity<MutexTestReport> mutexTest(
            @RequestParam String spec,
            @RequestParam(required = false) Integer workers,
            @RequestParam(required = false) Integer tests,
            @RequestParam(required = false) String verifyDelay) {
        AcctCtlProperties.MutexTest cfg = properties.getMutexTest();
        return ResponseEntity.ok(mutexTestService.run(spec,
                workers != null ? workers : cfg.getWorkers(),
                tests != null ? tests : cfg.getTests(),
                verifyDelay != null ? AccountController.parseDuration(verifyDelay) : cfg.getVerifyDelay()));
    }
}
