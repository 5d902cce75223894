/*
 * どこで: app/user/src/main/java/com/catalog/user/repository/UserRepository.java
 * 何を: ユーザーストアの検索/作成能力を表すインターフェース
 * なぜ: Service をストア実装から切り離し、テストでインメモリ実装へ差し替えるため
 */
package com.catalog.user.repository;

import com.catalog.user.model.User;
import java.util.Optional;

public interface UserRepository {

  /**
   * 役割:
   * - email + provider に一致するユーザーの内部 userId を返す。
   *
   * 期待動作:
   * - 該当なしは UserNotFoundException とし、その他の失敗と区別できるようにする。
   */
  String getId(String email, String provider);

  /**
   * 役割:
   * - ユーザーを登録し、採番した内部 userId を返す。
   *
   * 期待動作:
   * - 引数の id は無視する。
   * - email の一意制約違反は DuplicateUserException とする。
   */
  String create(User user);

  Optional<User> findById(String id);
}
