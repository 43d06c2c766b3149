package com.thermo.alert;

/**
 * Отправка оповещений владельцу.
 * <p>
 * Реализация не должна блокировать вызывающий поток на сетевом ответе и не должна
 * бросать исключения: ошибка доставки только логируется.
 */
public interface Notifier {

  void dispatch(AlertNotification notification);
}
