package com.budgetbuckets.ledger.controller;

import com.budgetbuckets.ledger.controller.dto.ResetResponseDto;
import com.budgetbuckets.ledger.controller.dto.UserCreateRequestDto;
import com.budgetbuckets.ledger.controller.dto.UserResponseDto;
import com.budgetbuckets.ledger.user.UserDataResetService;
import com.budgetbuckets.ledger.user.UserEntity;
import com.budgetbuckets.ledger.user.UserService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UsersController {

    private final UserService userService;
    private final UserDataResetService userDataResetService;

    public UsersController(UserService userService, UserDataResetService userDataResetService) {
        this.userService = userService;
        this.userDataResetService = userDataResetService;
    }

    @PostMapping
    public ResponseEntity<UserResponseDto> createUser(@RequestBody @Valid UserCreateRequestDto request) {
        UserEntity user = userService.createUser(request.name());
        return ResponseEntity.status(HttpStatus.CREATED).body(map(user));
    }

    @GetMapping
    public ResponseEntity<List<UserResponseDto>> listUsers() {
        return ResponseEntity.ok(userService.listUsers().stream().map(this::map).toList());
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserResponseDto> getUser(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(map(userService.getUser(userId)));
    }

    @DeleteMapping("/{userId}/data")
    public ResponseEntity<ResetResponseDto> deleteAllUserData(@PathVariable("userId") UUID userId) {
        var summary = userDataResetService.deleteAllUserData(userId);
        return ResponseEntity.ok(new ResetResponseDto(
                summary.userId().toString(),
                summary.bucketsDeleted(),
                summary.incomesDeleted(),
                summary.expensesDeleted(),
                summary.rolloverEntriesDeleted()
        ));
    }

    private UserResponseDto map(UserEntity user) {
        return new UserResponseDto(user.getId().toString(), user.getName(), user.getCreatedAt());
    }
}
