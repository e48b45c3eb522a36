package com.lendrisk.api;

import com.lendrisk.api.dto.CreditRecordView;
import com.lendrisk.api.dto.RegisterUserRequest;
import com.lendrisk.service.LendingProtocolService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Credit records. Registration is the only write; everything else on a record changes through protocol operations.
 */
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final LendingProtocolService service;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, String> register(@Validated @RequestBody RegisterUserRequest request) {
        return Map.of("userId", service.registerUser(request.getAccountAddress()));
    }

    @GetMapping("/{userId}")
    public CreditRecordView get(@PathVariable String userId) {
        return CreditRecordView.from(service.getCreditRecord(userId));
    }
}
