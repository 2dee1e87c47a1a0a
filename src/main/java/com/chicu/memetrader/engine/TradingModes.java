package com.chicu.memetrader.engine;

import com.chicu.memetrader.config.TraderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Режимы движка, которые переключаются снаружи во время работы.
 *
 * pause: тик оркестратора пропускается целиком;
 * drain: новые позиции не открываются, открытые закрываются как обычно.
 */
@Slf4j
@Component
public class TradingModes {

    private volatile boolean drainMode;
    private volatile boolean pauseMode;

    public TradingModes(TraderProperties props) {
        this.drainMode = props.isDrainMode();
        this.pauseMode = props.isPauseMode();
    }

    public boolean isDrainMode() {
        return drainMode;
    }

    public boolean isPauseMode() {
        return pauseMode;
    }

    public void setDrainMode(boolean enabled) {
        if (drainMode != enabled) {
            log.info("[ORCH] 🚰 drain mode {}", enabled ? "ON" : "OFF");
        }
        drainMode = enabled;
    }

    public void setPauseMode(boolean enabled) {
        if (pauseMode != enabled) {
            log.info("[ORCH] ⏸ pause mode {}", enabled ? "ON" : "OFF");
        }
        pauseMode = enabled;
    }
}
