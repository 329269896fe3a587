package com.example.checkout.application.service;

import com.example.checkout.application.dto.CheckoutCommand;
import com.example.checkout.application.port.in.CheckoutUseCase;
import com.example.checkout.application.port.out.AccountingPort;
import com.example.checkout.application.port.out.CartPort;
import com.example.checkout.application.port.out.CatalogPort;
import com.example.checkout.application.port.out.CatalogPort.ProductPrice;
import com.example.checkout.application.port.out.CurrencyPort;
import com.example.checkout.application.port.out.EmailPort;
import com.example.checkout.application.port.out.FraudDetectionPort;
import com.example.checkout.application.port.out.FraudDetectionPort.FraudCheckRequest;
import com.example.checkout.application.port.out.FraudDetectionPort.FraudVerdict;
import com.example.checkout.application.port.out.PaymentPort;
import com.example.checkout.application.port.out.PaymentPort.PaymentResult;
import com.example.checkout.application.port.out.ShippingPort;
import com.example.checkout.application.port.out.ShippingPort.ShippingQuote;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.CartItem;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderLine;
import io.micrometer.observation.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Drives one checkout request through its steps:
 * price and quote → currency conversion → payment → fraud check → shipment.
 *
 * <p>Steps after pricing run strictly one after another. Every attempted step records exactly one
 * {@link StepOutcome} into the request's {@link OrderContext}, and every collaborator call is bounded
 * by the request {@link Deadline}. Once a fatal failure is recorded no further step is started.
 * E-mail, cart cleanup, accounting and payment reversal are handed to the
 * {@link BackgroundTaskDispatcher} and never delay the response.
 */
@Service
public class CheckoutOrchestrator implements CheckoutUseCase {

    private static final Logger log = LoggerFactory.getLogger(CheckoutOrchestrator.class);

    public static final String CURRENCY_MISMATCH = "currency_mismatch";

    private final CatalogPort catalogPort;
    private final ShippingPort shippingPort;
    private final CurrencyPort currencyPort;
    private final PaymentPort paymentPort;
    private final FraudDetectionPort fraudDetectionPort;
    private final EmailPort emailPort;
    private final AccountingPort accountingPort;
    private final CartPort cartPort;
    private final OrderResultAggregator aggregator;
    private final BackgroundTaskDispatcher dispatcher;
    private final CheckoutTelemetry telemetry;
    private final CheckoutSettings settings;

    public CheckoutOrchestrator(
            CatalogPort catalogPort,
            ShippingPort shippingPort,
            CurrencyPort currencyPort,
            PaymentPort paymentPort,
            FraudDetectionPort fraudDetectionPort,
            EmailPort emailPort,
            AccountingPort accountingPort,
            CartPort cartPort,
            OrderResultAggregator aggregator,
            BackgroundTaskDispatcher dispatcher,
            CheckoutTelemetry telemetry,
            CheckoutSettings settings) {
        this.catalogPort = catalogPort;
        this.shippingPort = shippingPort;
        this.currencyPort = currencyPort;
        this.paymentPort = paymentPort;
        this.fraudDetectionPort = fraudDetectionPort;
        this.emailPort = emailPort;
        this.accountingPort = accountingPort;
        this.cartPort = cartPort;
        this.aggregator = aggregator;
        this.dispatcher = dispatcher;
        this.telemetry = telemetry;
        this.settings = settings;
    }

    @Override
    public CompletableFuture<Order> checkout(CheckoutCommand command) {
        OrderContext context = OrderContext.start(command);
        Deadline deadline = Deadline.after(settings.deadline());
        Observation observation = telemetry.startCheckout(context);
        CheckoutRun run = new CheckoutRun(context, deadline, observation);

        log.info("[{}] Checkout started: order={}, user={}, items={}, currency={}, deadline={}",
                command.correlationId(), context.getOrderId(), command.userId(),
                command.items().size(), command.currency(), deadline.budget());

        return CompletableFuture.<Void>completedFuture(null)
                .thenCompose(v -> resolvePricing(run))
                .thenCompose(v -> convertCurrency(run))
                .thenCompose(v -> charge(run))
                .thenCompose(v -> checkFraud(run))
                .thenCompose(v -> dispatchShipment(run))
                .handle((v, throwable) -> {
                    if (throwable != null) {
                        Throwable cause = unwrap(throwable);
                        log.error("[{}] Checkout aborted by unexpected error for order {}",
                                command.correlationId(), context.getOrderId(), cause);
                        telemetry.failCheckout(observation, cause);
                        context.abort(cause);
                    }
                    return complete(run);
                });
    }

    // Step 1: catalog prices and shipping quote, joined
    private CompletableFuture<Void> resolvePricing(CheckoutRun run) {
        OrderContext context = run.context();
        CheckoutCommand command = context.getCommand();

        CompletableFuture<StepOutcome<List<OrderLine>>> prices =
                observe(run, CheckoutStep.PRICE_LOOKUP, () -> lookUpPrices(command));
        CompletableFuture<StepOutcome<ShippingQuote>> quote =
                observe(run, CheckoutStep.SHIPPING_QUOTE, () -> shippingPort.quote(
                        command.correlationId(), command.shippingAddress(), command.items(), command.currency()));

        return prices.thenCombine(quote, (priceOutcome, quoteOutcome) -> {
            StepOutcome<ShippingQuote> checkedQuote = checkQuoteCurrency(quoteOutcome, command.currency());
            context.record(CheckoutStep.PRICE_LOOKUP, priceOutcome);
            context.record(CheckoutStep.SHIPPING_QUOTE, checkedQuote);

            if (priceOutcome.isFailure()) {
                log.warn("[{}] Price lookup failed for order {}: reason={}, message={}",
                        command.correlationId(), context.getOrderId(), priceOutcome.reason(), priceOutcome.message());
                return null;
            }

            Money shippingCost;
            if (checkedQuote.success()) {
                shippingCost = checkedQuote.payload().cost();
            } else {
                shippingCost = Money.of(settings.placeholderShippingCost(), command.currency());
                log.warn("[{}] Shipping quote failed for order {}: reason={}, placeholder {} applied",
                        command.correlationId(), context.getOrderId(), checkedQuote.reason(), shippingCost);
            }
            context.applyPricing(priceOutcome.payload(), shippingCost);
            log.info("[{}] Order {} priced: {} line(s), shipping={}, total={}",
                    command.correlationId(), context.getOrderId(), context.getLines().size(),
                    shippingCost, context.getTotal());
            return null;
        });
    }

    private CompletableFuture<StepOutcome<List<OrderLine>>> lookUpPrices(CheckoutCommand command) {
        List<CartItem> items = command.items();
        List<CompletableFuture<StepOutcome<ProductPrice>>> lookups = items.stream()
                .map(item -> catalogPort.getPrice(command.correlationId(), item.getProductId(), command.currency()))
                .toList();

        CompletableFuture<StepOutcome<List<OrderLine>>> priced =
                CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0]))
                        .thenApply(v -> {
                            List<OrderLine> lines = new ArrayList<>(items.size());
                            for (int i = 0; i < items.size(); i++) {
                                StepOutcome<ProductPrice> outcome = lookups.get(i).join();
                                if (outcome.isFailure()) {
                                    return StepOutcome.<List<OrderLine>>failure(
                                            outcome.reason(), outcome.message(), outcome.retryable());
                                }
                                Money unitPrice = outcome.payload().unitPrice();
                                if (!unitPrice.isIn(command.currency())) {
                                    return StepOutcome.<List<OrderLine>>failure(CURRENCY_MISMATCH,
                                            "Price of " + items.get(i).getProductId() + " quoted in "
                                                    + unitPrice.getCurrency() + ", expected " + command.currency(),
                                            false);
                                }
                                lines.add(items.get(i).priceAt(unitPrice));
                            }
                            return StepOutcome.success(lines);
                        });

        // the deadline cancels the joined future, pass that on to each lookup
        priced.whenComplete((outcome, throwable) -> {
            if (throwable instanceof CancellationException) {
                lookups.forEach(lookup -> lookup.cancel(true));
            }
        });
        return priced;
    }

    private StepOutcome<ShippingQuote> checkQuoteCurrency(StepOutcome<ShippingQuote> quote, String currency) {
        if (quote.success() && !quote.payload().cost().isIn(currency)) {
            return StepOutcome.failure(CURRENCY_MISMATCH,
                    "Shipping quoted in " + quote.payload().cost().getCurrency() + ", expected " + currency,
                    false);
        }
        return quote;
    }

    // Step 2
    private CompletableFuture<Void> convertCurrency(CheckoutRun run) {
        if (shouldStop(run)) {
            return done();
        }
        OrderContext context = run.context();
        CorrelationId correlationId = context.getCommand().correlationId();
        Money total = context.getTotal();
        String settlementCurrency = settings.settlementCurrency();

        if (total.isIn(settlementCurrency)) {
            context.record(CheckoutStep.CURRENCY_CONVERSION, StepOutcome.success(total));
            context.applySettlement(total);
            return done();
        }

        return observe(run, CheckoutStep.CURRENCY_CONVERSION,
                () -> currencyPort.convert(correlationId, total, settlementCurrency))
                .thenAccept(outcome -> {
                    StepOutcome<Money> checked = outcome.success() && !outcome.payload().isIn(settlementCurrency)
                            ? StepOutcome.<Money>failure(CURRENCY_MISMATCH,
                            "Converted into " + outcome.payload().getCurrency() + ", expected " + settlementCurrency,
                            false)
                            : outcome;
                    context.record(CheckoutStep.CURRENCY_CONVERSION, checked);
                    if (checked.success()) {
                        context.applySettlement(checked.payload());
                        log.info("[{}] Order {} converted: {} -> {}",
                                correlationId, context.getOrderId(), total, checked.payload());
                    } else {
                        log.warn("[{}] Currency conversion failed for order {}: reason={}, charging {}",
                                correlationId, context.getOrderId(), checked.reason(), total);
                    }
                });
    }

    // Step 3
    private CompletableFuture<Void> charge(CheckoutRun run) {
        if (shouldStop(run)) {
            return done();
        }
        OrderContext context = run.context();
        CheckoutCommand command = context.getCommand();
        Money amount = context.chargeAmount();

        return observe(run, CheckoutStep.PAYMENT, () -> paymentPort.charge(
                command.correlationId(), context.getOrderId(), amount, command.paymentToken()))
                .thenAccept(outcome -> {
                    context.record(CheckoutStep.PAYMENT, outcome);
                    if (outcome.success()) {
                        context.applyPayment(outcome.payload());
                        log.info("[{}] Order {} charged {}: transactionId={}",
                                command.correlationId(), context.getOrderId(), amount,
                                outcome.payload().transactionId());
                    } else {
                        log.warn("[{}] Payment failed for order {}: reason={}, retryable={}, message={}",
                                command.correlationId(), context.getOrderId(),
                                outcome.reason(), outcome.retryable(), outcome.message());
                    }
                });
    }

    // Step 4
    private CompletableFuture<Void> checkFraud(CheckoutRun run) {
        if (shouldStop(run)) {
            return done();
        }
        OrderContext context = run.context();
        CheckoutCommand command = context.getCommand();
        long itemCount = command.items().stream().mapToLong(CartItem::getQuantity).sum();
        FraudCheckRequest request = new FraudCheckRequest(context.getOrderId(), command.userId(),
                context.chargeAmount(), command.shippingAddress(), itemCount);

        return observe(run, CheckoutStep.FRAUD_CHECK,
                () -> fraudDetectionPort.check(command.correlationId(), request))
                .thenAccept(outcome -> {
                    context.record(CheckoutStep.FRAUD_CHECK, outcome);
                    if (outcome.isFailure()) {
                        log.warn("[{}] Fraud screening unavailable for order {}: reason={}, proceeding unscreened",
                                command.correlationId(), context.getOrderId(), outcome.reason());
                        return;
                    }
                    FraudVerdict verdict = outcome.payload();
                    if (verdict.flagged()) {
                        context.rejectAsFraud(verdict);
                        log.warn("[{}] Order {} flagged as fraudulent: reason={}, score={}",
                                command.correlationId(), context.getOrderId(), verdict.reason(), verdict.score());
                    }
                });
    }

    // Step 5
    private CompletableFuture<Void> dispatchShipment(CheckoutRun run) {
        if (shouldStop(run)) {
            return done();
        }
        OrderContext context = run.context();
        CheckoutCommand command = context.getCommand();

        return observe(run, CheckoutStep.SHIPMENT, () -> shippingPort.ship(
                command.correlationId(), context.getOrderId(), command.shippingAddress(), command.items()))
                .thenAccept(outcome -> {
                    context.record(CheckoutStep.SHIPMENT, outcome);
                    if (outcome.success()) {
                        context.applyShipment(outcome.payload().trackingId());
                        log.info("[{}] Order {} shipped: trackingId={}",
                                command.correlationId(), context.getOrderId(), outcome.payload().trackingId());
                    } else {
                        log.warn("[{}] Shipment failed for order {}: reason={}, must be retried out of band",
                                command.correlationId(), context.getOrderId(), outcome.reason());
                    }
                });
    }

    private Order complete(CheckoutRun run) {
        OrderContext context = run.context();
        if (context.isHaltedByDeadline()) {
            context.skipRemainingSteps();
        }

        Order order = aggregator.aggregate(context);
        telemetry.finishCheckout(run.observation(), order);
        log.info("[{}] Checkout finished: order={}, status={}, reason={}, warnings={}",
                order.correlationId(), order.orderId(), order.status().label(),
                order.rejectionReason(), order.warnings().size());

        dispatchFollowUps(context, order);
        return order;
    }

    private void dispatchFollowUps(OrderContext context, Order order) {
        CorrelationId correlationId = order.correlationId();

        PaymentResult payment = context.getPayment();
        if (!order.status().isCompleted() && payment != null) {
            Money charged = payment.charged() != null ? payment.charged() : context.chargeAmount();
            log.warn("[{}] Reversing charge {} of {} for {} order {}",
                    correlationId, payment.transactionId(), charged, order.status().label(), order.orderId());
            dispatcher.dispatch(CheckoutStep.PAYMENT_REVERSAL, correlationId,
                    () -> paymentPort.reverse(correlationId, payment.transactionId(), charged));
        }

        if (order.status().isCompleted()) {
            String email = context.getCommand().email();
            if (email != null && !email.isBlank()) {
                dispatcher.dispatch(CheckoutStep.EMAIL_CONFIRMATION, correlationId,
                        () -> emailPort.sendConfirmation(correlationId, email, order));
            }
            dispatcher.dispatch(CheckoutStep.CART_CLEANUP, correlationId,
                    () -> cartPort.emptyCart(correlationId, order.userId()));
        }

        dispatcher.dispatch(CheckoutStep.ACCOUNTING_PUBLISH, correlationId,
                () -> accountingPort.publish(correlationId, order));
    }

    /**
     * True when no further step may start. An expired deadline skips every remaining step.
     */
    private boolean shouldStop(CheckoutRun run) {
        if (run.context().isHalted()) {
            return true;
        }
        if (run.deadline().isExpired()) {
            run.context().skipRemainingSteps();
            return true;
        }
        return false;
    }

    private <T> CompletableFuture<StepOutcome<T>> observe(
            CheckoutRun run, CheckoutStep step, Supplier<CompletableFuture<StepOutcome<T>>> call) {
        return telemetry.observeStep(step, run.observation(),
                () -> run.deadline().bound(invoke(step, call))
                        .exceptionally(throwable -> failureOf(run, step, throwable)));
    }

    private <T> CompletableFuture<StepOutcome<T>> invoke(
            CheckoutStep step, Supplier<CompletableFuture<StepOutcome<T>>> call) {
        try {
            CompletableFuture<StepOutcome<T>> future = call.get();
            if (future == null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("No result returned by " + step.collaborator()));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> StepOutcome<T> failureOf(CheckoutRun run, CheckoutStep step, Throwable throwable) {
        CorrelationId correlationId = run.context().getCommand().correlationId();
        Throwable cause = unwrap(throwable);
        if (cause instanceof DeadlineExceededException) {
            log.warn("[{}] Step {} cut short by the {} request deadline",
                    correlationId, step.spanName(), run.deadline().budget());
            return StepOutcome.deadlineExceeded();
        }
        log.warn("[{}] Step {} failed unexpectedly: {}", correlationId, step.spanName(), cause.toString());
        return StepOutcome.failure(StepOutcome.ERROR, cause.getMessage(), false);
    }

    private static Throwable unwrap(Throwable throwable) {
        return throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause()
                : throwable;
    }

    private static CompletableFuture<Void> done() {
        return CompletableFuture.completedFuture(null);
    }

    private record CheckoutRun(OrderContext context, Deadline deadline, Observation observation) {
    }
}
