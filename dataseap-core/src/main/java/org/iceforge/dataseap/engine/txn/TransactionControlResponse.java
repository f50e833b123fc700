package org.iceforge.dataseap.engine.txn;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
record TransactionControlResponse(
        @JsonProperty("Status") String status,
        @JsonProperty("TxnId") Long txnId,
        @JsonProperty("ExistingTxnId") Long existingTxnId,
        @JsonProperty("msg") @JsonAlias("Message") String message
) {
    boolean isSuccess() {
        return "Success".equals(status) || "OK".equals(status);
    }
}
