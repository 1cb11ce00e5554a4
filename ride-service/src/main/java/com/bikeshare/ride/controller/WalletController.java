package com.bikeshare.ride.controller;

import com.bikeshare.ride.entity.Wallet;
import com.bikeshare.ride.model.TopUpRequest;
import com.bikeshare.ride.model.TransactionResponse;
import com.bikeshare.ride.model.WalletBalanceResponse;
import com.bikeshare.ride.model.WalletReconciliation;
import com.bikeshare.ride.service.WalletLedgerService;
import com.bikeshare.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.Map;

@Validated
@RestController
@RequestMapping("/api/v1/wallets")
@RequiredArgsConstructor
public class WalletController {

    private final WalletLedgerService walletLedger;

    @GetMapping("/{riderId}")
    public ResponseEntity<ApiResponse<WalletBalanceResponse>> getBalance(@PathVariable("riderId") String riderId) {
        Wallet wallet = walletLedger.getWallet(riderId);
        return ResponseEntity.ok(ApiResponse.ok(
                new WalletBalanceResponse(riderId, wallet.getBalance(), wallet.getCurrency())));
    }

    @PostMapping("/{riderId}/top-up")
    public ResponseEntity<ApiResponse<WalletBalanceResponse>> topUp(
            @PathVariable("riderId") String riderId,
            @Valid @RequestBody TopUpRequest request) {

        BigDecimal balance = walletLedger.credit(riderId, request.getAmount(), request.getReason(),
                request.getPaymentMethod(), Map.of("channel", "api"));
        return ResponseEntity.ok(ApiResponse.ok(
                new WalletBalanceResponse(riderId, balance, walletLedger.getWallet(riderId).getCurrency())));
    }

    @GetMapping("/{riderId}/transactions")
    public ResponseEntity<ApiResponse<Page<TransactionResponse>>> getTransactions(
            @PathVariable("riderId") String riderId,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "20") @Min(1) @Max(100) int size) {

        return ResponseEntity.ok(ApiResponse.ok(
                walletLedger.transactionHistory(riderId, page, size).map(TransactionResponse::from)));
    }

    @GetMapping("/{riderId}/reconciliation")
    public ResponseEntity<ApiResponse<WalletReconciliation>> reconcile(@PathVariable("riderId") String riderId) {
        return ResponseEntity.ok(ApiResponse.ok(walletLedger.reconcile(riderId)));
    }
}
