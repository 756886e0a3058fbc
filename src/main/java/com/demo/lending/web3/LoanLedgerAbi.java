package com.demo.lending.web3;

import com.demo.lending.domain.Addresses;
import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.domain.Token;
import com.demo.lending.domain.TokenKind;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Calls of the deployed lending contract used by the monitor, and decoding of their
 * return data. {@code loans(uint256)} is the public mapping getter; its outputs follow
 * the contract's storage struct.
 */
public final class LoanLedgerAbi {

    private LoanLedgerAbi() {}

    public static Function nextLoanId() {
        return new Function("nextLoanId", Collections.emptyList(),
                List.of(new TypeReference<Uint256>() {}));
    }

    public static Function loans(long loanId) {
        return new Function("loans", List.of(new Uint256(loanId)), List.of(
                new TypeReference<Uint256>() {},     // id
                new TypeReference<Address>() {},     // borrower
                new TypeReference<Address>() {},     // lender
                new TypeReference<Uint256>() {},     // tokenId
                new TypeReference<Uint256>() {},     // collateralTokenId
                new TypeReference<Uint256>() {},     // amount
                new TypeReference<Uint256>() {},     // collateralAmount
                new TypeReference<Uint256>() {},     // interestRate (bps)
                new TypeReference<Uint256>() {},     // duration
                new TypeReference<Uint256>() {},     // createdAt
                new TypeReference<Uint256>() {},     // fundedAt
                new TypeReference<Uint256>() {},     // dueDate
                new TypeReference<Uint8>() {},       // status
                new TypeReference<Utf8String>() {},  // ipfsDocumentHash
                new TypeReference<Uint256>() {},     // riskScore
                new TypeReference<Bool>() {}         // collateralClaimed
        ));
    }

    public static Function supportedTokens(int tokenId) {
        return new Function("supportedTokens", List.of(new Uint256(tokenId)), List.of(
                new TypeReference<Uint8>() {},
                new TypeReference<Address>() {},
                new TypeReference<Utf8String>() {},
                new TypeReference<Uint8>() {},
                new TypeReference<Bool>() {},
                new TypeReference<Address>() {}
        ));
    }

    public static Function calculateUsdValue(int tokenId, BigInteger rawAmount) {
        return new Function("calculateUSDValue", List.of(new Uint256(tokenId), new Uint256(rawAmount)),
                List.of(new TypeReference<Uint256>() {}));
    }

    public static Function liquidate(long loanId) {
        return new Function("liquidate", List.of(new Uint256(loanId)), Collections.emptyList());
    }

    public static Function approve(String spender, BigInteger amount) {
        return new Function("approve", List.of(new Address(spender), new Uint256(amount)),
                List.of(new TypeReference<Bool>() {}));
    }

    public static String encode(Function function) {
        return FunctionEncoder.encode(function);
    }

    /** Single uint256 result. */
    public static BigInteger decodeUint(Function function, String returnData) {
        List<Type> out = decode(function, returnData);
        if (out.isEmpty()) {
            throw new IllegalArgumentException(function.getName() + " returned no data");
        }
        return (BigInteger) out.get(0).getValue();
    }

    /** Empty when the slot is unused, i.e. the borrower is the zero address. */
    public static Optional<Loan> decodeLoan(String returnData) {
        List<Type> out = decode(loans(0), returnData);
        if (out.size() < 16) {
            throw new IllegalArgumentException("loans() returned " + out.size() + " fields, expected 16");
        }
        String borrower = ((Address) out.get(1)).getValue();
        if (Addresses.isEmpty(borrower)) {
            return Optional.empty();
        }
        BigInteger principal = uint(out, 5);
        BigInteger fundedAt = uint(out, 10);
        BigInteger dueDate = uint(out, 11);
        LoanStatus status = LoanStatus.fromCode(uint(out, 12).intValueExact());
        String documentRef = ((Utf8String) out.get(13)).getValue();
        return Optional.of(Loan.builder()
                .id(uint(out, 0).longValueExact())
                .borrower(Addresses.normalize(borrower))
                .loanTokenId(uint(out, 3).intValueExact())
                .collateralTokenId(uint(out, 4).intValueExact())
                .principal(principal)
                .collateralAmount(uint(out, 6))
                .interestRateBps(uint(out, 7).intValueExact())
                .durationSecs(uint(out, 8).longValueExact())
                .minContribution(BigInteger.ZERO)
                .fundingPeriodSecs(0)
                .createdAt(Instant.ofEpochSecond(uint(out, 9).longValueExact()))
                .fundedAt(fundedAt.signum() == 0 ? null : Instant.ofEpochSecond(fundedAt.longValueExact()))
                .dueDate(dueDate.signum() == 0 ? null : Instant.ofEpochSecond(dueDate.longValueExact()))
                .status(status)
                .amountFunded(status == LoanStatus.REQUESTED ? BigInteger.ZERO : principal)
                .riskScore(uint(out, 14).intValueExact())
                .collateralClaimed(((Bool) out.get(15)).getValue())
                .documentRef(documentRef.isEmpty() ? null : documentRef)
                .build());
    }

    public static Token decodeToken(int tokenId, String returnData) {
        List<Type> out = decode(supportedTokens(tokenId), returnData);
        if (out.size() < 6) {
            throw new IllegalArgumentException("supportedTokens() returned " + out.size() + " fields, expected 6");
        }
        String feed = ((Address) out.get(5)).getValue();
        return new Token(
                tokenId,
                TokenKind.fromCode(uint(out, 0).intValueExact()),
                Addresses.normalize(((Address) out.get(1)).getValue()),
                ((Utf8String) out.get(2)).getValue(),
                uint(out, 3).intValueExact(),
                ((Bool) out.get(4)).getValue(),
                Addresses.isEmpty(feed) ? null : Addresses.normalize(feed));
    }

    private static List<Type> decode(Function function, String returnData) {
        if (returnData == null || returnData.isEmpty() || "0x".equals(returnData)) {
            return Collections.emptyList();
        }
        return FunctionReturnDecoder.decode(returnData, function.getOutputParameters());
    }

    private static BigInteger uint(List<Type> out, int index) {
        return (BigInteger) out.get(index).getValue();
    }
}
