package com.derivsim.core.engine;

import com.derivsim.core.command.CancelOrder;
import com.derivsim.core.command.Command;
import com.derivsim.core.command.CommandHandler;
import com.derivsim.core.command.CommandResult;
import com.derivsim.core.command.DetectLiquidations;
import com.derivsim.core.command.GetInsuranceFund;
import com.derivsim.core.command.GetState;
import com.derivsim.core.command.LiquidationStep;
import com.derivsim.core.command.ManualAdjustment;
import com.derivsim.core.command.ManualLiquidate;
import com.derivsim.core.command.MarkPriceResult;
import com.derivsim.core.command.PlaceOrder;
import com.derivsim.core.command.PlaceOrderResult;
import com.derivsim.core.command.ResetState;
import com.derivsim.core.command.RiskSweep;
import com.derivsim.core.command.SetAdlEnabled;
import com.derivsim.core.command.SetLiquidationEnabled;
import com.derivsim.core.command.ToggleResult;
import com.derivsim.core.command.UpdateMarkPrice;
import com.derivsim.core.domain.InsuranceFundEntry;
import com.derivsim.core.domain.Order;
import com.derivsim.core.domain.OrderType;
import com.derivsim.core.domain.Trade;
import com.derivsim.core.domain.User;
import com.derivsim.core.exception.InvariantViolationException;
import com.derivsim.core.exception.NotFoundException;
import com.derivsim.core.exception.ValidationException;
import com.derivsim.core.snapshot.ExchangeSnapshot;
import com.derivsim.core.snapshot.OrderView;
import com.derivsim.core.snapshot.SnapshotAssembler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Owns the exchange state and applies one command at a time. Not thread-safe: callers serialize access,
 * normally through the command ring buffer.
 */
@Slf4j
public class Exchange implements CommandHandler<CommandResult> {

    public static final String ADL_METHOD = "adl";

    private final ExchangeSettings settings;
    @Getter
    private final ExchangeState state;

    private final RiskValidator validator = new RiskValidator();
    private final MatchingEngine matchingEngine = new MatchingEngine();
    private final PositionLedger ledger = new PositionLedger();
    private final LiquidationEngine liquidationEngine = new LiquidationEngine();
    private final AdlEngine adlEngine = new AdlEngine(ledger);
    private final ConsistencyChecker consistencyChecker = new ConsistencyChecker();
    private final SnapshotAssembler snapshots;

    public Exchange(ExchangeSettings settings) {
        this.settings = settings;
        this.state = new ExchangeState(settings);
        this.snapshots = new SnapshotAssembler(liquidationEngine, adlEngine, new MarginMonitor(),
                consistencyChecker, settings.getTradeHistorySize());
    }

    /**
     * Applies a command. Validation and lookup failures become failed results; invariant violations in
     * strict mode propagate.
     */
    public CommandResult handle(Command command) {
        try {
            return command.accept(this);
        } catch (ValidationException | NotFoundException e) {
            log.warn("Command {} rejected: {}", command.commandName(), e.getMessage());
            return CommandResult.fail(command.commandName(), e.getMessage(), snapshot());
        }
    }

    public ExchangeSnapshot snapshot() {
        return snapshots.assemble(state);
    }

    // ==================== orders ====================

    @Override
    public CommandResult onPlaceOrder(PlaceOrder cmd) {
        OrderType type = cmd.orderType() != null ? cmd.orderType() : OrderType.LIMIT;
        User user = validator.requireUser(state, cmd.userId());
        BigDecimal leverage = cmd.leverage() != null ? cmd.leverage() : user.getLeverage();
        validator.validateOrder(state, cmd.userId(), cmd.side(), type, cmd.size(), cmd.price(), leverage);

        user.setLeverage(leverage);
        Order order = Order.of(cmd.userId(), cmd.side(), type, cmd.price(), cmd.size(), leverage);
        MatchResult match = matchingEngine.submitOrder(state.getOrderBook(), order);

        for (Trade trade : match.trades()) {
            state.recordTrade(trade);
            ledger.applyTrade(state, trade);
        }
        ledger.markToMarket(state);
        log.info("Order {} {} {} {} {} @ {} x{}: {} filled in {} trade(s), status {}", order.getOrderId(),
                order.getUserId(), order.getSide(), type, order.getQuantity(), order.getPrice(), leverage,
                order.getFilledQuantity(), match.trades().size(), order.getStatus());

        RiskSweep risk = automaticRiskSweep();
        verifyInvariants("place_order");
        return CommandResult.ok(cmd.commandName(), new PlaceOrderResult(OrderView.of(order), match.trades(),
                match.selfTradeCanceled().stream().map(Order::getOrderId).toList(),
                match.rested(), match.discardedQuantity(), risk), snapshot());
    }

    @Override
    public CommandResult onCancelOrder(CancelOrder cmd) {
        if (cmd.orderId() == null || cmd.orderId().isBlank()) {
            throw new ValidationException("orderId is required");
        }
        Order order = state.getOrderBook().get(cmd.orderId());
        if (order == null) {
            throw new NotFoundException("order " + cmd.orderId() + " is not on the book");
        }
        if (cmd.userId() != null && !cmd.userId().equals(order.getUserId())) {
            throw new ValidationException("order " + cmd.orderId() + " does not belong to " + cmd.userId());
        }
        state.getOrderBook().remove(cmd.orderId());
        order.cancel();
        log.info("Order {} of {} canceled", order.getOrderId(), order.getUserId());
        verifyInvariants("cancel_order");
        return CommandResult.ok(cmd.commandName(), OrderView.of(order), snapshot());
    }

    // ==================== prices & risk ====================

    @Override
    public CommandResult onUpdateMarkPrice(UpdateMarkPrice cmd) {
        validator.validatePrice(cmd.price(), "price");
        if (cmd.indexPrice() != null) {
            validator.validatePrice(cmd.indexPrice(), "indexPrice");
            state.setIndexPrice(cmd.indexPrice());
        }
        BigDecimal previous = state.getMarkPrice();
        state.setMarkPrice(cmd.price());
        ledger.markToMarket(state);
        log.info("Mark price {} -> {}", previous, cmd.price());

        List<LiquidationCandidate> candidates = liquidationEngine.detect(state);
        RiskSweep risk = automaticRiskSweep();
        verifyInvariants("update_mark_price");
        return CommandResult.ok(cmd.commandName(),
                new MarkPriceResult(state.getMarkPrice(), state.getIndexPrice(), candidates, risk), snapshot());
    }

    @Override
    public CommandResult onDetectLiquidations(DetectLiquidations cmd) {
        return CommandResult.ok(cmd.commandName(), liquidationEngine.detect(state), snapshot());
    }

    @Override
    public CommandResult onManualLiquidate(ManualLiquidate cmd) {
        validator.requireUser(state, cmd.userId());
        LiquidationResult result = liquidationEngine.liquidate(state, cmd.userId());
        ledger.markToMarket(state);
        verifyInvariants("manual_liquidate");
        return CommandResult.ok(cmd.commandName(), result, snapshot());
    }

    @Override
    public CommandResult onLiquidationStep(LiquidationStep cmd) {
        String method = cmd.method() == null ? ADL_METHOD : cmd.method().toLowerCase(Locale.ROOT);
        if (!ADL_METHOD.equals(method)) {
            throw new ValidationException("unsupported liquidation method: " + cmd.method());
        }
        List<AdlResult> results = adlEngine.executeAll(state);
        ledger.markToMarket(state);
        verifyInvariants("liquidation_step");
        return CommandResult.ok(cmd.commandName(), results, snapshot());
    }

    // ==================== insurance fund ====================

    @Override
    public CommandResult onManualAdjustment(ManualAdjustment cmd) {
        if (cmd.amount() == null || cmd.amount().signum() == 0) {
            throw new ValidationException("amount must be non-zero");
        }
        String description = cmd.description() == null || cmd.description().isBlank()
                ? "manual adjustment" : cmd.description();
        InsuranceFundEntry entry = state.getInsuranceFund().apply(InsuranceFundEntry.Type.MANUAL_ADJUSTMENT,
                cmd.amount(), description);
        // money entering or leaving from outside the ledger
        state.setEquityBaseline(state.getEquityBaseline().add(cmd.amount()));
        log.info("Insurance fund adjusted by {} ({}), balance {}", cmd.amount(), description, entry.balanceAfter());
        verifyInvariants("manual_adjustment");
        return CommandResult.ok(cmd.commandName(), entry, snapshot());
    }

    @Override
    public CommandResult onGetInsuranceFund(GetInsuranceFund cmd) {
        return CommandResult.ok(cmd.commandName(), snapshots.insuranceFund(state), snapshot());
    }

    // ==================== flags & lifecycle ====================

    @Override
    public CommandResult onSetLiquidationEnabled(SetLiquidationEnabled cmd) {
        state.setLiquidationEnabled(cmd.enabled());
        log.info("Automatic liquidation {}", cmd.enabled() ? "enabled" : "disabled");
        return CommandResult.ok(cmd.commandName(), new ToggleResult("liquidationEnabled", cmd.enabled()), snapshot());
    }

    @Override
    public CommandResult onSetAdlEnabled(SetAdlEnabled cmd) {
        state.setAdlEnabled(cmd.enabled());
        log.info("Automatic ADL {}", cmd.enabled() ? "enabled" : "disabled");
        return CommandResult.ok(cmd.commandName(), new ToggleResult("adlEnabled", cmd.enabled()), snapshot());
    }

    @Override
    public CommandResult onResetState(ResetState cmd) {
        state.reset(settings);
        log.info("Exchange state reset");
        return CommandResult.ok(cmd.commandName(), null, snapshot());
    }

    @Override
    public CommandResult onGetState(GetState cmd) {
        return CommandResult.ok(cmd.commandName(), null, snapshot());
    }

    // ==================== internals ====================

    /**
     * Liquidates every position past its liquidation price when enabled, then runs ADL if the fund can no
     * longer cover the inventory.
     */
    private RiskSweep automaticRiskSweep() {
        if (!state.isLiquidationEnabled()) {
            return RiskSweep.NONE;
        }
        List<LiquidationResult> liquidations = liquidationEngine.liquidateAll(state);
        List<AdlResult> adl = List.of();
        if (state.isAdlEnabled() && !state.getLiquidationInventory().isEmpty()
                && liquidationEngine.checkInsuranceFundSufficiency(state).atRisk()) {
            log.warn("Insurance fund at risk, running ADL over {} engine position(s)",
                    state.getLiquidationInventory().getPositions().size());
            adl = adlEngine.executeAll(state);
        }
        if (!liquidations.isEmpty() || !adl.isEmpty()) {
            ledger.markToMarket(state);
        }
        return new RiskSweep(liquidations, adl);
    }

    private void verifyInvariants(String command) {
        ZeroSumReport report = consistencyChecker.check(state);
        if (report.consistent()) {
            return;
        }
        if (settings.isStrictInvariants()) {
            throw new InvariantViolationException(report.violations());
        }
        log.error("Invariant violation after {}: {}", command, report.violations());
    }
}
