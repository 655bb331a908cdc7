package com.derivsim.core.command;

/**
 * One method per command, so adding a command breaks every handler until it is handled.
 */
public interface CommandHandler<R> {

    R onPlaceOrder(PlaceOrder command);

    R onCancelOrder(CancelOrder command);

    R onUpdateMarkPrice(UpdateMarkPrice command);

    R onDetectLiquidations(DetectLiquidations command);

    R onManualLiquidate(ManualLiquidate command);

    R onLiquidationStep(LiquidationStep command);

    R onManualAdjustment(ManualAdjustment command);

    R onGetInsuranceFund(GetInsuranceFund command);

    R onSetLiquidationEnabled(SetLiquidationEnabled command);

    R onSetAdlEnabled(SetAdlEnabled command);

    R onResetState(ResetState command);

    R onGetState(GetState command);
}
