package com.demo.lending.controller;

import com.demo.lending.controller.dto.AssetDtos;
import com.demo.lending.service.AssetVault;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/assets")
@RequiredArgsConstructor
public class AssetController {

    private final AssetVault vault;

    // admin only, see WebConfig
    @PostMapping("/faucet")
    public AssetDtos.Holding faucet(@Valid @RequestBody AssetDtos.Faucet body) {
        vault.faucet(body.holder, body.tokenId, body.amount);
        return holding(body.holder, body.tokenId);
    }

    @PostMapping("/approve")
    public AssetDtos.Holding approve(@Valid @RequestBody AssetDtos.Approve body) {
        vault.approve(body.owner, body.tokenId, body.amount);
        return holding(body.owner, body.tokenId);
    }

    @GetMapping("/balance")
    public AssetDtos.Holding balance(@RequestParam String holder, @RequestParam int tokenId) {
        return holding(holder, tokenId);
    }

    @GetMapping("/escrow")
    public Map<String, Object> escrow() {
        return Map.of("address", vault.escrow());
    }

    private AssetDtos.Holding holding(String holder, int tokenId) {
        AssetDtos.Holding h = new AssetDtos.Holding();
        h.holder = holder;
        h.tokenId = tokenId;
        h.balance = vault.balanceOf(holder, tokenId);
        h.allowance = vault.allowanceOf(holder, tokenId);
        return h;
    }
}
