/*
 * どこで: identity API リクエスト DTO 共通
 * 何を: OperationResolver が必要権限を判定する対象のマーカー
 * なぜ: リクエスト形ごとに必要な operation を一か所で決めるため
 */
package com.example.identity.api.request;

/**
 * Marker for every request shape the identity API accepts.
 *
 * <p>Not sealed: the transport layer may hand over shapes that the resolver does not know, and
 * those must resolve to the no-access operation.
 */
public interface ApiRequest {}
