package com.derivsim.core.command;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * A request to the exchange. The set is closed: decoding an unknown {@code type} fails at the boundary.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PlaceOrder.class, name = "place_order"),
        @JsonSubTypes.Type(value = CancelOrder.class, name = "cancel_order"),
        @JsonSubTypes.Type(value = UpdateMarkPrice.class, name = "update_mark_price"),
        @JsonSubTypes.Type(value = DetectLiquidations.class, name = "detect_liquidations"),
        @JsonSubTypes.Type(value = ManualLiquidate.class, name = "manual_liquidate"),
        @JsonSubTypes.Type(value = LiquidationStep.class, name = "liquidation_step"),
        @JsonSubTypes.Type(value = ManualAdjustment.class, names = {"manual_adjustment", "adjust_insurance_fund"}),
        @JsonSubTypes.Type(value = GetInsuranceFund.class, name = "get_insurance_fund"),
        @JsonSubTypes.Type(value = SetLiquidationEnabled.class, name = "set_liquidation_enabled"),
        @JsonSubTypes.Type(value = SetAdlEnabled.class, name = "set_adl_enabled"),
        @JsonSubTypes.Type(value = ResetState.class, name = "reset_state"),
        @JsonSubTypes.Type(value = GetState.class, name = "get_state")
})
public interface Command {

    <R> R accept(CommandHandler<R> handler);

    /** Wire name of the command, e.g. {@code place_order}. */
    default String commandName() {
        JsonTypeName name = getClass().getAnnotation(JsonTypeName.class);
        return name != null ? name.value() : getClass().getSimpleName();
    }
}
