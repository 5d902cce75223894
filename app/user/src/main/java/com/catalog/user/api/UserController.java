/*
 * どこで: app/user/src/main/java/com/catalog/user/api/UserController.java
 * 何を: 解決済みユーザーを参照する API を提供するコントローラー
 * なぜ: identity Filter が付与した userId を下流ハンドラが読めることを明示するため
 */
package com.catalog.user.api;

import com.catalog.user.api.response.MeResponse;
import com.catalog.user.api.response.UserResponse;
import com.catalog.user.context.CurrentUserId;
import com.catalog.user.model.User;
import com.catalog.user.repository.UserNotFoundException;
import com.catalog.user.repository.UserRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1beta1")
public class UserController {

    private final UserRepository userRepository;

    public UserController(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @GetMapping("/me")
    public ResponseEntity<MeResponse> me(@CurrentUserId String userId) {
        return ResponseEntity.ok(new MeResponse(userId));
    }

    /**
     * 役割:
     * - 解決済み userId のユーザーレコードを返す。
     *
     * 期待動作:
     * - Filter 通過後に呼ばれるため userId は必ず存在する。
     * - レコードが消えている場合は 404 へマッピングする。
     */
    @GetMapping("/users/me")
    public ResponseEntity<UserResponse> currentUser(@CurrentUserId String userId) {
        final User user = userRepository.findById(userId).orElseThrow(UserNotFoundException::new);
        return ResponseEntity.ok(
                new UserResponse(
                        user.id(), user.email(), user.provider(), user.createdAt(), user.updatedAt()));
    }
}
