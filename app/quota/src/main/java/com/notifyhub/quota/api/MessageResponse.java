/*
 * どこで: Quota API
 * 何を: 結果メッセージのみのレスポンスを表す
 * なぜ: 削除系操作の応答形式を揃えるため
 */
package com.notifyhub.quota.api;

public record MessageResponse(String message) {}
