package com.streamearn.controller.dto;

import com.streamearn.model.WalletBalance;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record WalletResponse(
        String address,
        Map<String, BigDecimal> balances
) {

    public static WalletResponse of(String address, List<WalletBalance> balances) {
        Map<String, BigDecimal> byToken = new LinkedHashMap<>();
        balances.forEach(balance -> byToken.put(balance.getTokenSymbol(), balance.getBalance()));
        return new WalletResponse(address, byToken);
    }
}
