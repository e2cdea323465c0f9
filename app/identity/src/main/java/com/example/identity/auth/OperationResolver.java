/*
 * どこで: identity の認可層
 * 何を: API リクエストの形から、呼び出し元が持つべき operation を決める
 * なぜ: 認可エンジンへ渡す権限をハンドラごとに散らさず一か所で固定するため
 */
package com.example.identity.auth;

import com.example.identity.api.request.ApiRequest;
import com.example.identity.api.request.DeleteSshKeysRequest;
import com.example.identity.api.request.DischargeTokenForUserRequest;
import com.example.identity.api.request.ModifyUserGroupsRequest;
import com.example.identity.api.request.PutSshKeysRequest;
import com.example.identity.api.request.QueryUsersRequest;
import com.example.identity.api.request.SetUserExtraInfoItemRequest;
import com.example.identity.api.request.SetUserExtraInfoRequest;
import com.example.identity.api.request.SetUserGroupsRequest;
import com.example.identity.api.request.SetUserRequest;
import com.example.identity.api.request.SshKeysRequest;
import com.example.identity.api.request.UserExtraInfoItemRequest;
import com.example.identity.api.request.UserExtraInfoRequest;
import com.example.identity.api.request.UserGroupsRequest;
import com.example.identity.api.request.UserIdpGroupsRequest;
import com.example.identity.api.request.UserRequest;
import com.example.identity.api.request.UserTokenRequest;
import com.example.identity.api.request.VerifyTokenRequest;
import com.example.identity.api.request.WhoAmIRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class OperationResolver {

  private static final Logger logger = LoggerFactory.getLogger(OperationResolver.class);

  /**
   * Returns the operation performed by the API handler that takes {@code request}.
   *
   * <p>Never throws. Unknown shapes, including {@code null}, and user-scoped requests without a
   * target username resolve to {@link Operation#NONE}.
   */
  public Operation resolve(ApiRequest request) {
    if (request instanceof QueryUsersRequest) {
      return Operation.global(Action.READ);
    }
    if (request instanceof UserRequest r) {
      return user(r, r.username(), Action.READ);
    }
    if (request instanceof SetUserRequest r) {
      // agent の作成は owner のスコープで許可する
      if (r.hasOwner()) {
        return user(r, r.owner(), Action.CREATE_AGENT);
      }
      return user(r, r.username(), Action.WRITE_ADMIN);
    }
    if (request instanceof UserGroupsRequest r) {
      return user(r, r.username(), Action.READ_GROUPS);
    }
    if (request instanceof SetUserGroupsRequest r) {
      return user(r, r.username(), Action.WRITE_GROUPS);
    }
    if (request instanceof ModifyUserGroupsRequest r) {
      return user(r, r.username(), Action.WRITE_GROUPS);
    }
    if (request instanceof UserIdpGroupsRequest r) {
      return user(r, r.username(), Action.READ_GROUPS);
    }
    if (request instanceof WhoAmIRequest) {
      return Operation.LOGIN;
    }
    if (request instanceof SshKeysRequest r) {
      return user(r, r.username(), Action.READ_SSH_KEYS);
    }
    if (request instanceof PutSshKeysRequest r) {
      return user(r, r.username(), Action.WRITE_SSH_KEYS);
    }
    if (request instanceof DeleteSshKeysRequest r) {
      return user(r, r.username(), Action.WRITE_SSH_KEYS);
    }
    if (request instanceof UserTokenRequest r) {
      return user(r, r.username(), Action.READ_ADMIN);
    }
    if (request instanceof VerifyTokenRequest) {
      return Operation.global(Action.VERIFY);
    }
    if (request instanceof UserExtraInfoRequest r) {
      return user(r, r.username(), Action.READ_ADMIN);
    }
    if (request instanceof SetUserExtraInfoRequest r) {
      return user(r, r.username(), Action.WRITE_ADMIN);
    }
    if (request instanceof UserExtraInfoItemRequest r) {
      return user(r, r.username(), Action.READ_ADMIN);
    }
    if (request instanceof SetUserExtraInfoItemRequest r) {
      return user(r, r.username(), Action.WRITE_ADMIN);
    }
    if (request instanceof DischargeTokenForUserRequest) {
      return Operation.global(Action.DISCHARGE_FOR);
    }
    logger.info(
        "unknown API request type {}",
        request == null ? "null" : request.getClass().getName());
    return Operation.NONE;
  }

  // 対象ユーザー名が空のリクエストは誰にも許可できないので NONE に落とす
  private Operation user(ApiRequest request, String username, Action action) {
    if (username == null || username.isBlank()) {
      logger.info("API request {} has no target user", request.getClass().getName());
      return Operation.NONE;
    }
    return Operation.user(username, action);
  }
}
