/*
 * どこで: identity のドメインモデル
 * 何を: 外部 ID から解決したローカルユーザー
 * なぜ: IdP の検証結果とセッション/認可処理を同じ型で受け渡すため
 */
package com.example.identity.model;

import java.util.List;

public record LocalUser(String userId, String username, String accountStatus, List<String> roles) {

  public LocalUser {
    roles = roles == null ? List.of() : List.copyOf(roles);
  }

  public boolean isActive() {
    return "ACTIVE".equals(accountStatus);
  }
}
