package com.thermo.service;

import com.thermo.config.ValidationLimits;
import com.thermo.db.AlertSettingsDao;
import com.thermo.model.AlertSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AlertSettingsServiceTest {

  @Mock
  private AlertSettingsDao alertSettingsDao;

  private AlertSettingsService service;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    service = new AlertSettingsService(alertSettingsDao, new ValidationLimits(-50, 100, 5, 35, 0.1, 5.0, 10080));
  }

  private AlertSettings valid() {
    AlertSettings settings = AlertSettings.defaults("TH-1");
    settings.setEnabled(true);
    settings.setHighEnabled(true);
    settings.setLowEnabled(true);
    return settings;
  }

  @Test
  @DisplayName("Настроек нет → значения по умолчанию, оповещения выключены")
  void shouldReturnDefaults() {
    when(alertSettingsDao.find("TH-1")).thenReturn(Optional.empty());

    AlertSettings settings = service.get("TH-1");

    assertThat(settings.isEnabled()).isFalse();
    assertThat(settings.getHighThresholdC()).isEqualTo(AlertSettings.DEFAULT_HIGH_THRESHOLD_C);
    assertThat(settings.getLowThresholdC()).isEqualTo(AlertSettings.DEFAULT_LOW_THRESHOLD_C);
    assertThat(settings.getCooldownMinutes()).isEqualTo(AlertSettings.DEFAULT_COOLDOWN_MINUTES);
  }

  @Test
  @DisplayName("Валидные настройки сохраняются, пустой адрес сбрасывается")
  void shouldSaveValidSettings() {
    AlertSettings settings = valid();
    settings.setCustomEmail("   ");

    service.update(settings);

    verify(alertSettingsDao).save(settings);
    assertThat(settings.getCustomEmail()).isNull();
  }

  @Test
  @DisplayName("Нижний порог не ниже верхнего → отказ")
  void shouldRejectInvertedThresholds() {
    AlertSettings settings = valid();
    settings.setLowThresholdC(25);
    settings.setHighThresholdC(20);

    assertThatThrownBy(() -> service.update(settings))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("below high");
    verify(alertSettingsDao, never()).save(any());
  }

  @Test
  @DisplayName("Порядок порогов не проверяется, если одно направление выключено")
  void shouldAllowAnyOrderWhenOneDirectionDisabled() {
    AlertSettings settings = valid();
    settings.setLowEnabled(false);
    settings.setLowThresholdC(25);
    settings.setHighThresholdC(20);

    service.update(settings);

    verify(alertSettingsDao).save(settings);
  }

  @Test
  @DisplayName("Cooldown вне 1..max, порог вне физического диапазона и неверный адрес → все ошибки сразу")
  void shouldReportAllViolations() {
    AlertSettings settings = valid();
    settings.setCooldownMinutes(0);
    settings.setHighThresholdC(500);
    settings.setCustomEmail("not-an-email");

    assertThat(service.validate(settings)).hasSize(3);
    assertThatThrownBy(() -> service.update(settings)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Максимальный cooldown допустим, на единицу больше нет")
  void shouldApplyCooldownBounds() {
    AlertSettings settings = valid();
    settings.setCooldownMinutes(10080);
    assertThat(service.validate(settings)).isEmpty();

    settings.setCooldownMinutes(10081);
    assertThat(service.validate(settings)).hasSize(1);
  }
}
