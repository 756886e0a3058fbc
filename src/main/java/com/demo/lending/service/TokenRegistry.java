package com.demo.lending.service;

import com.demo.lending.domain.Addresses;
import com.demo.lending.domain.Token;
import com.demo.lending.exception.LendingException;
import com.demo.lending.exception.LendingException.Reason;
import com.demo.lending.exception.UnknownTokenException;
import com.demo.lending.repository.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class TokenRegistry {

    private static final int MAX_DECIMALS = 36;

    private final TokenRepository tokens;
    private final LedgerWriter writer;

    /** Fails if the id is already taken by an active token; an inactive entry is replaced. */
    public Token register(Token token) {
        if (token.id() < 0) {
            throw new LendingException(Reason.INVALID_REQUEST, "Token id must be non-negative");
        }
        if (token.symbol() == null || token.symbol().isBlank()) {
            throw new LendingException(Reason.INVALID_REQUEST, "Token symbol required");
        }
        if (token.decimals() < 0 || token.decimals() > MAX_DECIMALS) {
            throw new LendingException(Reason.INVALID_REQUEST, "Token decimals out of range: " + token.decimals());
        }
        if (token.kind() == null) {
            throw new LendingException(Reason.INVALID_REQUEST, "Token kind required");
        }
        Token toSave = token.withActive(true).withAssetRef(Addresses.normalize(token.assetRef()));
        return writer.write(() -> {
            tokens.find(token.id()).filter(Token::active).ifPresent(existing -> {
                throw new LendingException(Reason.TOKEN_ALREADY_ACTIVE,
                        "Token id " + token.id() + " already active as " + existing.symbol());
            });
            tokens.save(toSave);
            log.info("Registered token {} {} ({} decimals, feed={})",
                    toSave.id(), toSave.symbol(), toSave.decimals(), toSave.priceFeedRef());
            return toSave;
        });
    }

    /** Idempotent. Existing loans keep referencing the token. */
    public Token deactivate(int id) {
        return writer.write(() -> {
            Token t = get(id);
            if (t.active()) {
                tokens.setActive(id, false);
                log.info("Deactivated token {} {}", id, t.symbol());
            }
            return t.withActive(false);
        });
    }

    public Token get(int id) {
        return tokens.find(id).orElseThrow(() -> new UnknownTokenException(id));
    }

    public Token requireActive(int id) {
        Token t = get(id);
        if (!t.active()) {
            throw new LendingException(Reason.TOKEN_INACTIVE, "Token " + t.symbol() + " is not accepted for new loans");
        }
        return t;
    }

    public boolean exists(int id) {
        return tokens.find(id).isPresent();
    }

    public List<Token> list() {
        return tokens.findAll();
    }
}
