package com.example.issuance.controller;

import com.example.issuance.ledger.TokenLedger;
import com.example.issuance.model.Address;
import com.example.issuance.model.ApproveRequest;
import com.example.issuance.model.BurnRequest;
import com.example.issuance.model.MintReceipt;
import com.example.issuance.model.MintRequest;
import com.example.issuance.service.IssuanceService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.example.issuance.controller.IssuerController.CALLER_HEADER;

@RestController
@RequestMapping("/token")
public class TokenController {

    private final IssuanceService issuanceService;
    private final TokenLedger ledger;

    public TokenController(IssuanceService issuanceService, TokenLedger ledger) {
        this.issuanceService = issuanceService;
        this.ledger = ledger;
    }

    @GetMapping(value = "/supply", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getTotalSupply() {
        return ResponseEntity.ok(Map.of("total_supply", ledger.totalSupply().toString()));
    }

    @GetMapping(value = "/balances/{account}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getBalance(@PathVariable String account) {
        Address holder = Address.of(account);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("account", holder.value());
        response.put("balance", ledger.balanceOf(holder).toString());
        return ResponseEntity.ok(response);
    }

    @PostMapping(value = "/mint",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> mint(@RequestBody MintRequest request,
                                                    @RequestHeader(CALLER_HEADER) String caller) {
        MintReceipt receipt = issuanceService.mint(Address.of(request.to()), request.amount(), Address.of(caller));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("to", receipt.to().value());
        response.put("minted", receipt.minted().toString());
        response.put("top_up", receipt.topUp().toString());
        response.put("total_supply", receipt.totalSupply().toString());
        return ResponseEntity.ok(response);
    }

    @PostMapping(value = "/burn",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> burn(@RequestBody BurnRequest request,
                                                    @RequestHeader(CALLER_HEADER) String caller) {
        issuanceService.burn(request.amount(), Address.of(caller));
        return burned(request.amount());
    }

    @PostMapping(value = "/burn-from",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> burnFrom(@RequestBody BurnRequest request,
                                                        @RequestHeader(CALLER_HEADER) String caller) {
        issuanceService.burnFrom(Address.of(request.account()), request.amount(), Address.of(caller));
        return burned(request.amount());
    }

    @PostMapping(value = "/approve",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> approve(@RequestBody ApproveRequest request,
                                                       @RequestHeader(CALLER_HEADER) String caller) {
        Address owner = Address.of(caller);
        Address spender = Address.of(request.spender());
        return allowance(owner, spender, issuanceService.approve(owner, spender, request.amount()));
    }

    @GetMapping(value = "/allowances/{owner}/{spender}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getAllowance(@PathVariable String owner, @PathVariable String spender) {
        Address ownerAddress = Address.of(owner);
        Address spenderAddress = Address.of(spender);
        return allowance(ownerAddress, spenderAddress, issuanceService.getAllowance(ownerAddress, spenderAddress));
    }

    private static ResponseEntity<Map<String, Object>> allowance(Address owner, Address spender, BigInteger amount) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("owner", owner.value());
        response.put("spender", spender.value());
        response.put("allowance", amount.toString());
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> burned(BigInteger amount) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("burned", amount.toString());
        response.put("total_supply", ledger.totalSupply().toString());
        return ResponseEntity.ok(response);
    }
}
