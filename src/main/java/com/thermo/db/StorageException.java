package com.thermo.db;

/**
 * Хранилище недоступно или операция с базой данных завершилась ошибкой.
 * <p>
 * Повтор не выполняется на уровне DAO: решение о повторе принимает внешний вызывающий.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
