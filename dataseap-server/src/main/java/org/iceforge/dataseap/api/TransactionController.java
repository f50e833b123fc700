package org.iceforge.dataseap.api;

import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.iceforge.dataseap.txn.TransactionLease;
import org.iceforge.dataseap.txn.TransactionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Objects;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/transactions")
public class TransactionController {

    private final TransactionService transactions;

    public TransactionController(TransactionService transactions) {
        this.transactions = Objects.requireNonNull(transactions);
    }

    @GetMapping("/{txnId}")
    public ResponseEntity<ApiResponse<TransactionLease>> get(@PathVariable long txnId) {
        Optional<TransactionLease> lease = transactions.find(txnId);
        if (lease.isEmpty()) {
            return ApiErrors.toResponse(new DataseapException(ErrorCode.NOT_FOUND, "No lease for transaction " + txnId));
        }
        return ApiErrors.ok(lease.get());
    }

    @PostMapping("/{database}/{table}/begin")
    public ResponseEntity<ApiResponse<TransactionLease>> begin(@PathVariable String database,
                                                               @PathVariable String table,
                                                               @RequestParam String label,
                                                               @RequestParam(required = false) Integer timeoutSeconds) {
        try {
            return ApiErrors.ok(transactions.begin(database, table, label, timeoutSeconds));
        } catch (DataseapException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping("/{database}/{txnId}/commit")
    public ResponseEntity<ApiResponse<TransactionLease>> commit(@PathVariable String database, @PathVariable long txnId) {
        try {
            return ApiErrors.ok(transactions.commit(database, txnId));
        } catch (DataseapException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping("/{database}/{txnId}/abort")
    public ResponseEntity<ApiResponse<TransactionLease>> abort(@PathVariable String database, @PathVariable long txnId) {
        try {
            return ApiErrors.ok(transactions.abort(database, txnId));
        } catch (DataseapException e) {
            return ApiErrors.toResponse(e);
        }
    }
}
