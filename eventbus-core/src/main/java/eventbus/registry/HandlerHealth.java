package eventbus.registry;

import eventbus.HealthStatus;

import java.util.List;

/**
 * Registry health: {@link HealthStatus#HEALTHY} when every handler that has run keeps a success
 * rate of at least {@value DefaultHandlerRegistry#HEALTHY_SUCCESS_RATE}.
 *
 * @param status            overall status
 * @param handlerCount      registered handlers
 * @param unhealthyHandlers handlers below the threshold
 */
public record HandlerHealth(HealthStatus status, int handlerCount, List<String> unhealthyHandlers) {

    public HandlerHealth {
        unhealthyHandlers = List.copyOf(unhealthyHandlers);
    }
}
