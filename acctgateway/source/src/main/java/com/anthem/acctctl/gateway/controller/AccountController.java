package com.anthem.acctctl.gateway.controller;

import com.anthem.acctctl.gateway.model.AccountCredentials;
import com.anthem.acctctl.gateway.model.AccountView;
import com.anthem.acctctl.gateway.model.UpdateRequest;
import com.anthem.acctctl.gateway.service.AccountControlService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * REST Controller for account control operations.
 *
 * Every operation selects accounts with an account spec, e.g.
 * {@code spec=owner=me,test} or {@code spec=123456789012}. An empty spec
 * matches all accounts.
 */
@RestController
@RequestMapping(value = "/acctctl/v1/accounts", produces = MediaType.APPLICATION_JSON_VALUE)
public class AccountController {

    private static final Logger log = LoggerFactory.getLogger(AccountController.class);

    private final AccountControlService accountControlService;

    public AccountController(AccountControlService accountControlService) {
        this.accountControlService = accountControlService;
    }

    @GetMapping
    public ResponseEntity<List<AccountView>> list(
            @RequestParam(defaultValue = "") String spec,
            @RequestParam(defaultValue = "false") boolean refresh) {
        log.info("List accounts: spec={}, refresh={}", spec, refresh);
        return ResponseEntity.ok(accountControlService.list(spec, refresh));
    }

    /**
     * Claims free accounts. {@code num=-1} claims all matching free accounts.
     */
    @PostMapping("/alloc")
    public ResponseEntity<List<AccountView>> alloc(
            @RequestParam(defaultValue = "1") int num,
            @RequestParam(defaultValue = "") String spec,
            @RequestParam(required = false) String owner) {
        log.info("Allocate accounts: num={}, spec={}, owner={}", num, spec, owner);
        return ResponseEntity.ok(accountControlService.alloc(num, spec, owner));
    }

    @PostMapping("/free")
    public ResponseEntity<List<AccountView>> free(
            @RequestParam String spec,
            @RequestParam(defaultValue = "false") boolean force) {
        log.info("Free accounts: spec={}, force={}", spec, force);
        return ResponseEntity.ok(accountControlService.free(spec, force));
    }

    @PatchMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<AccountView>> update(
            @RequestParam String spec,
            @RequestBody UpdateRequest request) {
        log.info("Update accounts: spec={}", spec);
        return ResponseEntity.ok(accountControlService.update(spec, request));
    }

    @PostMapping("/tags")
    public ResponseEntity<List<AccountView>> tag(
            @RequestParam String spec,
            @RequestParam String tags) {
        log.info("Tag accounts: spec={}, tags={}", spec, tags);
        return ResponseEntity.ok(accountControlService.tag(spec, tags));
    }

    @PostMapping("/ctl")
    public ResponseEntity<List<AccountView>> initCtl(
            @RequestParam String spec,
            @RequestParam(required = false) String tags) {
        log.info("Initialize account control: spec={}", spec);
        return ResponseEntity.ok(accountControlService.initCtl(spec, tags));
    }

    @DeleteMapping("/ctl")
    public ResponseEntity<List<AccountView>> removeCtl(
            @RequestParam String spec,
            @RequestParam(defaultValue = "false") boolean force) {
        log.info("Remove account control: spec={}, force={}", spec, force);
        return ResponseEntity.ok(accountControlService.removeCtl(spec, force));
    }

    /**
     * Returns temporary credentials valid for at least {@code validity}
     * (ISO-8601 duration).
     */
    @GetMapping("/creds")
    public ResponseEntity<List<AccountCredentials>> creds(
            @RequestParam String spec,
            @RequestParam(defaultValue = "PT1M") String validity,
            @RequestParam(defaultValue = "false") boolean renew) {
        log.info("Get account credentials: spec={}, validity={}, renew={}", spec, validity, renew);
        return ResponseEntity.ok(accountControlService.creds(spec, parseDuration(validity), renew));
    }

    static Duration parseDuration(String s) {
        try {
            return Duration.parse(s);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid duration \"" + s + "\"", e);
        }
    }
}
