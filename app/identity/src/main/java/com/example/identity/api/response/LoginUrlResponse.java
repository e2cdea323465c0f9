/*
 * どこで: identity API レスポンス DTO
 * 何を: /v1/idp/{idp}/login の戻り値
 * なぜ: クライアントがログイン開始 URL を明示的に受け取れるようにするため
 */
package com.example.identity.api.response;

public record LoginUrlResponse(String loginUrl) {}
