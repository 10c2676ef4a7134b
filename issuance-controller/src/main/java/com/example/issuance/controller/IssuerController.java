package com.example.issuance.controller;

import com.example.issuance.event.IssuerEvent;
import com.example.issuance.event.IssuerEventLog;
import com.example.issuance.model.Address;
import com.example.issuance.model.IssuerRecord;
import com.example.issuance.service.IssuanceService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/issuers")
public class IssuerController {

    static final String CALLER_HEADER = "X-Caller-Address";

    private final IssuanceService issuanceService;
    private final IssuerEventLog eventLog;

    public IssuerController(IssuanceService issuanceService, IssuerEventLog eventLog) {
        this.issuanceService = issuanceService;
        this.eventLog = eventLog;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getIssuers() {
        return ResponseEntity.ok(Map.of("issuers", toValues(issuanceService.getIssuers())));
    }

    @GetMapping(value = "/expired", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getExpiredIssuers() {
        return ResponseEntity.ok(Map.of("issuers", toValues(issuanceService.getExpiredIssuers())));
    }

    @GetMapping(value = "/{identity}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getIssuer(@PathVariable String identity) {
        Address issuer = Address.of(identity);
        IssuerRecord record = issuanceService.getIssuerRecord(issuer);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("identity", issuer.value());
        response.put("position", record.getPosition());
        response.put("start_block", record.getStartBlock());
        response.put("expiration_block", record.getExpirationBlock());
        response.put("total_minted", record.getTotalMinted().toString());
        response.put("mint_count", record.getMintCount());
        response.put("total_burned", record.getTotalBurned().toString());
        response.put("burn_count", record.getBurnCount());
        response.put("mint_factor", issuanceService.getIssuerMintFactor(issuer));
        response.put("max_mintable", issuanceService.getIssuerMaxMintable(issuer).toString());
        return ResponseEntity.ok(response);
    }

    @PostMapping(value = "/{identity}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> authorizeIssuer(@PathVariable String identity) {
        Address issuer = Address.of(identity);
        IssuerRecord record = issuanceService.authorizeIssuer(issuer);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("identity", issuer.value());
        response.put("position", record.getPosition());
        response.put("expiration_block", record.getExpirationBlock());
        return ResponseEntity.ok(response);
    }

    @DeleteMapping(value = "/{identity}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> deauthorizeIssuer(@PathVariable String identity,
                                                                 @RequestHeader(CALLER_HEADER) String caller) {
        Address issuer = Address.of(identity);
        issuanceService.deauthorizeIssuer(issuer, Address.of(caller));
        return ResponseEntity.ok(Map.of("deauthorized", issuer.value()));
    }

    @PostMapping(value = "/expired/sweep", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> deauthorizeAllExpired(@RequestHeader(CALLER_HEADER) String caller) {
        List<Address> removed = issuanceService.deauthorizeAllExpiredIssuers(Address.of(caller));
        return ResponseEntity.ok(Map.of("deauthorized", toValues(removed)));
    }

    @PostMapping(value = "/transfer/{newIdentity}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> transferAuthorization(@PathVariable String newIdentity,
                                                                     @RequestHeader(CALLER_HEADER) String caller) {
        Address from = Address.of(caller);
        Address to = Address.of(newIdentity);
        int position = issuanceService.transferIssuerAuthorization(to, from);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("from", from.value());
        response.put("to", to.value());
        response.put("position", position);
        return ResponseEntity.ok(response);
    }

    @GetMapping(value = "/events", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getEvents() {
        List<Map<String, Object>> events = eventLog.entries().stream()
                .map(IssuerController::toView)
                .toList();
        return ResponseEntity.ok(Map.of("events", events));
    }

    private static List<String> toValues(List<Address> addresses) {
        return addresses.stream().map(Address::value).toList();
    }

    private static Map<String, Object> toView(IssuerEvent event) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("type", event.type());
        view.put("block", event.block());
        if (event instanceof IssuerEvent.IssuerAuthorized e) {
            view.put("issuer", e.issuer().value());
            view.put("expiration_block", e.expirationBlock());
        } else if (event instanceof IssuerEvent.IssuerDeauthorized e) {
            view.put("issuer", e.issuer().value());
            view.put("caller", e.caller().value());
        } else if (event instanceof IssuerEvent.IssuerAuthorizationTransferred e) {
            view.put("from", e.from().value());
            view.put("to", e.to().value());
            view.put("position", e.position());
        } else if (event instanceof IssuerEvent.IssuerActivity e) {
            view.put("issuer", e.issuer().value());
            view.put("minted", e.minted().toString());
            view.put("burned", e.burned().toString());
            view.put("total_minted", e.totalMinted().toString());
            view.put("total_burned", e.totalBurned().toString());
        }
        return view;
    }
}
