/*
 * どこで: Quota ドメインモデル
 * 何を: 送信ドメイン認証で登録すべき DNS レコード 1 件を表す
 * なぜ: プロバイダ応答と domain_dns_records 列の形式を揃えるため
 */
package com.notifyhub.quota.model;

public record DnsRecord(String type, String host, String value) {}
