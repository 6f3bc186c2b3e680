package com.mouse.keeper.controller;

import com.mouse.keeper.exception.AccountNotFoundException;
import com.mouse.keeper.manager.AccountPool;
import com.mouse.keeper.model.Account;
import com.mouse.keeper.model.AccountUpdate;
import com.mouse.keeper.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/accounts")
public class AccountController {

    private final AccountRepository accountRepository;
    private final AccountPool accountPool;

    @GetMapping
    public ResponseEntity<List<Account>> list() {
        return ResponseEntity.ok(accountRepository.findAll());
    }

    @GetMapping("/{name}")
    public ResponseEntity<Account> get(@PathVariable String name) {
        return ResponseEntity.ok(accountRepository.findByName(name)
                .orElseThrow(() -> new AccountNotFoundException(name)));
    }

    @PostMapping
    public ResponseEntity<Account> add(@RequestBody Account account) {
        return ResponseEntity.status(HttpStatus.CREATED).body(accountRepository.add(account));
    }

    @PutMapping("/{name}")
    public ResponseEntity<Account> update(@PathVariable String name, @RequestBody AccountUpdate changes) {
        Account updated = accountRepository.update(name, changes);
        if (changes.getApiKey() != null) {
            accountPool.resetHealth(name);
        }
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Map<String, Object>> remove(@PathVariable String name) {
        accountRepository.remove(name);
        accountPool.forget(name);
        return ResponseEntity.ok(Map.of("status", "success", "removed", name));
    }

    @PostMapping("/{name}/toggle")
    public ResponseEntity<Account> toggle(@PathVariable String name) {
        return ResponseEntity.ok(accountRepository.toggle(name));
    }

    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        List<Account> accounts = accountPool.reload();
        return ResponseEntity.ok(Map.of("status", "success", "accounts", accounts.size()));
    }
}
