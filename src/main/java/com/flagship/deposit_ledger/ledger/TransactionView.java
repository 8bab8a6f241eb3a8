package com.flagship.deposit_ledger.ledger;

import com.flagship.deposit_ledger.account.AccountType;
import lombok.Value;

/**
 * A transaction as shown in account history, tagged with its account's type.
 */
@Value
public class TransactionView {
    LedgerTransaction transaction;
    AccountType accountType;
}
