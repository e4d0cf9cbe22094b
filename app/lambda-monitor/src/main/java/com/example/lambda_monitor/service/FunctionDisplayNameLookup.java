package com.example.lambda_monitor.service;

import java.util.Optional;

/** 関数の表示名の上書きを引くインターフェース。 */
public interface FunctionDisplayNameLookup {

  Optional<String> findDisplayName(String functionName);
}
