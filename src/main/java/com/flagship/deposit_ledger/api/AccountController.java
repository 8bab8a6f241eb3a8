package com.flagship.deposit_ledger.api;

import com.flagship.deposit_ledger.account.AccountService;
import com.flagship.deposit_ledger.api.dto.AccountResponse;
import com.flagship.deposit_ledger.api.dto.FundAccountRequest;
import com.flagship.deposit_ledger.api.dto.FundingResponse;
import com.flagship.deposit_ledger.api.dto.OpenAccountRequest;
import com.flagship.deposit_ledger.api.dto.TransactionResponse;
import com.flagship.deposit_ledger.ledger.FundingResult;
import com.flagship.deposit_ledger.ledger.FundingService;
import com.flagship.deposit_ledger.ledger.TransactionHistoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for deposit accounts.
 *
 * The caller identity arrives in the X-User-Id header, set by the
 * authentication layer in front of this service. All mapping of ledger
 * failures to HTTP statuses lives in GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    public static final String USER_ID_HEADER = "X-User-Id";

    private final AccountService accountService;
    private final FundingService fundingService;
    private final TransactionHistoryService historyService;

    @PostMapping
    public ResponseEntity<AccountResponse> openAccount(
            @Valid @RequestBody OpenAccountRequest request,
            @RequestHeader(USER_ID_HEADER) long callerId) {

        log.info("Received account opening request: type={}", request.getAccountType());
        AccountResponse body = AccountResponse.from(accountService.openAccount(callerId, request.getAccountType()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping
    public List<AccountResponse> listAccounts(@RequestHeader(USER_ID_HEADER) long callerId) {
        return accountService.listAccounts(callerId).stream()
            .map(AccountResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public AccountResponse getAccount(@PathVariable("id") long accountId,
                                      @RequestHeader(USER_ID_HEADER) long callerId) {
        return AccountResponse.from(accountService.getAccount(callerId, accountId));
    }

    @PostMapping("/{id}/fundings")
    public FundingResponse fundAccount(@PathVariable("id") long accountId,
                                       @Valid @RequestBody FundAccountRequest request,
                                       @RequestHeader(USER_ID_HEADER) long callerId) {

        log.info("Received funding request: accountId={}, amount={}, source={}",
                accountId, request.getAmount(), request.getFundingSource().getType());
        FundingResult result = fundingService.fund(callerId, accountId, request.toFundingRequest());
        return FundingResponse.from(result);
    }

    @GetMapping("/{id}/transactions")
    public List<TransactionResponse> listTransactions(@PathVariable("id") long accountId,
                                                      @RequestHeader(USER_ID_HEADER) long callerId) {
        return historyService.listTransactions(callerId, accountId).stream()
            .map(TransactionResponse::from)
            .toList();
    }
}
