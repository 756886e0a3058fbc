package com.demo.lending.service;

import com.demo.lending.domain.Contribution;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ProRata {

    private ProRata() {}

    /**
     * share = floor(total * stake / denominator); the rounding remainder goes to the
     * first stake so the shares always sum to {@code total}.
     */
    static Map<String, BigInteger> split(BigInteger total, List<Contribution> stakes, BigInteger denominator) {
        Map<String, BigInteger> shares = new LinkedHashMap<>();
        if (stakes.isEmpty() || denominator.signum() == 0) return shares;
        BigInteger paid = BigInteger.ZERO;
        for (Contribution c : stakes) {
            BigInteger share = total.multiply(c.amount()).divide(denominator);
            shares.merge(c.lender(), share, BigInteger::add);
            paid = paid.add(share);
        }
        BigInteger remainder = total.subtract(paid);
        if (remainder.signum() != 0) {
            shares.merge(stakes.get(0).lender(), remainder, BigInteger::add);
        }
        return shares;
    }
}
