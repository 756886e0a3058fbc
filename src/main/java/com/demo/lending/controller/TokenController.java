package com.demo.lending.controller;

import com.demo.lending.controller.dto.TokenDtos;
import com.demo.lending.domain.Token;
import com.demo.lending.service.TokenRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tokens")
@RequiredArgsConstructor
public class TokenController {

    private final TokenRegistry registry;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Token register(@Valid @RequestBody TokenDtos.RegisterToken body) {
        return registry.register(body.toToken());
    }

    @PostMapping("/{id}/deactivate")
    public Token deactivate(@PathVariable int id) {
        return registry.deactivate(id);
    }

    @GetMapping("/{id}")
    public Token get(@PathVariable int id) {
        return registry.get(id);
    }

    @GetMapping
    public List<Token> list() {
        return registry.list();
    }
}
