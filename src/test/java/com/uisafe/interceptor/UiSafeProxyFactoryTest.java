package com.uisafe.interceptor;

import com.uisafe.executor.Action;
import com.uisafe.executor.DirectInteractor;
import com.uisafe.executor.FailureClassifier;
import com.uisafe.executor.Interactor;
import com.uisafe.executor.RecoveringInteractor;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Unit tests for the dispatch proxy.
 *
 * A small fake "view" stands in for a UI element: it implements two capability
 * interfaces and records every call it receives.
 */
public class UiSafeProxyFactoryTest {

    // ── Capability interfaces and a fake view ────────────────────────────────

    public interface Clickable {
        void click();
        String label();
    }

    public interface Typeable {
        String type(String text, int times);
    }

    public interface TextField extends Typeable {
        String read() throws IOException;
        default String shout() { return read0().toUpperCase(); }
        String read0();
    }

    /** Not interactable until scrolled, then behaves normally. */
    static class NotVisibleException extends RuntimeException {
        NotVisibleException() { super("element not visible"); }
    }

    public static class FakeView implements Clickable, TextField {
        final List<String> calls = new ArrayList<>();
        int failuresLeft;
        boolean scrolled;

        @Override public void click() {
            calls.add("click");
            if (failuresLeft > 0) {
                failuresLeft--;
                throw new NotVisibleException();
            }
        }
        @Override public String label()                 { calls.add("label"); return "Submit"; }
        @Override public String type(String text, int n) { calls.add("type:" + text + ":" + n); return text.repeat(n); }
        @Override public String read() throws IOException { calls.add("read"); throw new IOException("detached"); }
        @Override public String read0()                 { calls.add("read0"); return "hello"; }
        @Override public String toString()              { return "FakeView"; }
    }

    /** Equal to any other view with the same id, like elements found twice by the same locator. */
    static class IdentifiedView implements Clickable {
        final String id;

        IdentifiedView(String id) { this.id = id; }

        @Override public void click()    {}
        @Override public String label()  { return id; }
        @Override public boolean equals(Object o) {
            return o instanceof IdentifiedView other && other.id.equals(id);
        }
        @Override public int hashCode()  { return id.hashCode(); }
    }

    /** Counts how many actions it was handed. */
    static class CountingInteractor implements Interactor<Object> {
        int interactions;
        @Override
        public <R> R interact(Object context, Action<R> action) {
            interactions++;
            return action.invoke();
        }
    }

    private FakeView           view;
    private CountingInteractor counting;

    @BeforeMethod
    public void setUp() {
        view     = new FakeView();
        counting = new CountingInteractor();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Forwarding
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void forwardsCallWithIdenticalArgumentsAndReturnsTargetValue() {
        Typeable proxy = UiSafeProxyFactory.forCapability(Typeable.class, view, counting, view);

        String result = proxy.type("ab", 3);

        assertThat(result).isEqualTo("ababab");
        assertThat(view.calls).containsExactly("type:ab:3");
        assertThat(counting.interactions).isEqualTo(1);
    }

    @Test
    public void forImplementation_exposesAllInterfaces() {
        Object proxy = UiSafeProxyFactory.forImplementation(view, counting, view);

        assertThat(proxy).isInstanceOf(Clickable.class).isInstanceOf(TextField.class).isInstanceOf(Typeable.class);
        assertThat(proxy).isNotInstanceOf(FakeView.class);

        ((Clickable) proxy).click();
        assertThat(((Clickable) proxy).label()).isEqualTo("Submit");
        assertThat(((Typeable) proxy).type("x", 2)).isEqualTo("xx");

        assertThat(view.calls).containsExactly("click", "label", "type:x:2");
        assertThat(counting.interactions).isEqualTo(3);
    }

    @Test
    public void forCapability_includesSuperInterfaces() {
        TextField proxy = UiSafeProxyFactory.forCapability(TextField.class, view, counting, view);

        assertThat(proxy).isInstanceOf(Typeable.class);
        assertThat(proxy.type("z", 1)).isEqualTo("z");
    }

    @Test
    public void callsAreForwardedInOrderWithoutDeduplication() {
        Clickable proxy = UiSafeProxyFactory.forCapability(Clickable.class, view, counting, view);

        proxy.click();
        proxy.click();
        proxy.label();
        proxy.click();

        assertThat(view.calls).containsExactly("click", "click", "label", "click");
        assertThat(counting.interactions).isEqualTo(4);
    }

    @Test
    public void defaultMethod_runsAgainstTarget() {
        TextField proxy = UiSafeProxyFactory.forCapability(TextField.class, view, counting, view);

        assertThat(proxy.shout()).isEqualTo("HELLO");
        assertThat(view.calls).containsExactly("read0");
    }

    @Test
    public void contextIsHandedToInteractor() {
        List<Object> seen = new ArrayList<>();
        Interactor<String> recording = new Interactor<>() {
            @Override
            public <R> R interact(String context, Action<R> action) {
                seen.add(context);
                return action.invoke();
            }
        };

        Clickable proxy = UiSafeProxyFactory.forCapability(Clickable.class, view, recording, "button#submit");
        proxy.label();

        assertThat(seen).containsExactly("button#submit");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Failures through the proxy
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void recoveryThroughProxy_retriesUnderlyingCall() {
        view.failuresLeft = 1;
        RecoveringInteractor<FakeView> scrolling = new RecoveringInteractor<>(
            FailureClassifier.ofType(NotVisibleException.class), v -> v.scrolled = true);

        Clickable proxy = UiSafeProxyFactory.forCapability(Clickable.class, view, scrolling, view);
        proxy.click();

        assertThat(view.scrolled).isTrue();
        assertThat(view.calls).containsExactly("click", "click");
    }

    @Test
    public void unrecoveredFailure_callerSeesTargetsOwnException() {
        view.failuresLeft = 5;
        Clickable proxy = UiSafeProxyFactory.forCapability(Clickable.class, view, new DirectInteractor<>(), view);

        Throwable thrown = catchThrowable(proxy::click);

        assertThat(thrown).isExactlyInstanceOf(NotVisibleException.class);
    }

    @Test
    public void recoveryFails_callerSeesFirstFailureObject() {
        view.failuresLeft = 2;
        List<Throwable> raised = new ArrayList<>();
        Interactor<Object> capturing = new Interactor<>() {
            private final RecoveringInteractor<Object> delegate = new RecoveringInteractor<>(
                FailureClassifier.ofType(NotVisibleException.class), ctx -> { });
            @Override
            public <R> R interact(Object context, Action<R> action) {
                return delegate.interact(context, () -> {
                    try {
                        return action.invoke();
                    } catch (RuntimeException e) {
                        raised.add(e);
                        throw e;
                    }
                });
            }
        };

        Clickable proxy = UiSafeProxyFactory.forCapability(Clickable.class, view, capturing, view);
        Throwable thrown = catchThrowable(proxy::click);

        assertThat(raised).hasSize(2);
        assertThat(thrown).isSameAs(raised.get(0)).isNotSameAs(raised.get(1));
    }

    @Test
    public void declaredCheckedException_isRethrownUnwrapped() {
        TextField proxy = UiSafeProxyFactory.forCapability(TextField.class, view, counting, view);

        Throwable thrown = catchThrowable(proxy::read);

        assertThat(thrown).isExactlyInstanceOf(IOException.class).hasMessage("detached");
    }

    @Test
    public void checkedFailure_isClassifiableByInteractor() {
        List<String> corrections = new ArrayList<>();
        RecoveringInteractor<Object> recovering = new RecoveringInteractor<>(
            FailureClassifier.ofType(IOException.class), ctx -> corrections.add("reattached"));
        TextField proxy = UiSafeProxyFactory.forCapability(TextField.class, view, recovering, view);

        Throwable thrown = catchThrowable(proxy::read);

        assertThat(thrown).isInstanceOf(IOException.class);
        assertThat(corrections).containsExactly("reattached");
        assertThat(view.calls).containsExactly("read", "read");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Object methods and unwrapping
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void objectMethods_bypassInteractor() {
        Clickable proxy = UiSafeProxyFactory.forCapability(Clickable.class, view, counting, view);

        assertThat(proxy.toString()).isEqualTo("FakeView");
        assertThat(proxy.hashCode()).isEqualTo(view.hashCode());
        assertThat(proxy.equals(proxy)).isTrue();
        assertThat(proxy.equals(view)).isTrue();
        assertThat(proxy.equals(new FakeView())).isFalse();
        assertThat(proxy.equals(null)).isFalse();
        assertThat(counting.interactions).isZero();
    }

    @Test
    public void equals_followsTargetEquality() {
        IdentifiedView target = new IdentifiedView("e-1");
        IdentifiedView sameElement = new IdentifiedView("e-1");
        Clickable proxy = UiSafeProxyFactory.forCapability(Clickable.class, target, counting, target);
        Clickable otherProxy = UiSafeProxyFactory.forCapability(Clickable.class, sameElement, counting, sameElement);

        assertThat(target.equals(sameElement)).isTrue();
        assertThat(proxy.equals(sameElement)).isTrue();
        assertThat(proxy.equals(otherProxy)).isTrue();
        assertThat(proxy.equals(new IdentifiedView("e-2"))).isFalse();
        assertThat(proxy.hashCode()).isEqualTo(sameElement.hashCode());
        assertThat(counting.interactions).isZero();
    }

    @Test
    public void unwrap_returnsTarget() {
        Clickable proxy = UiSafeProxyFactory.forCapability(Clickable.class, view, counting, view);

        assertThat(UiSafeProxyFactory.isUiSafeProxy(proxy)).isTrue();
        assertThat(UiSafeProxyFactory.isUiSafeProxy(view)).isFalse();
        assertThat(UiSafeProxyFactory.isUiSafeProxy(null)).isFalse();
        assertThat(UiSafeProxyFactory.unwrap(proxy)).isSameAs(view);
        assertThat(UiSafeProxyFactory.unwrap(view)).isSameAs(view);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Construction errors
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void concreteClassCapability_isRejected() {
        assertThatThrownBy(() -> UiSafeProxyFactory.forCapability(FakeView.class, view, counting, view))
            .isInstanceOf(InvalidCapabilityException.class)
            .hasMessageContaining("not an interface")
            .satisfies(e -> assertThat(((InvalidCapabilityException) e).getCapability()).isEqualTo(FakeView.class));
    }

    @Test
    public void targetWithoutInterfaces_isRejected() {
        Object plain = new Object();

        assertThatThrownBy(() -> UiSafeProxyFactory.forImplementation(plain, counting, plain))
            .isInstanceOf(EmptyCapabilitySetException.class)
            .satisfies(e -> assertThat(((EmptyCapabilitySetException) e).getTargetType()).isEqualTo(Object.class));
    }

    @Test
    public void explicitCapabilities_mustBeImplementedByTarget() {
        assertThatThrownBy(() -> UiSafeProxyFactory.forCapabilities(
                view, List.of(Clickable.class, Runnable.class), counting, view))
            .isInstanceOf(InvalidCapabilityException.class)
            .hasMessageContaining("does not implement");
    }

    @Test
    public void explicitCapabilities_emptyListIsRejected() {
        assertThatThrownBy(() -> UiSafeProxyFactory.forCapabilities(view, List.of(), counting, view))
            .isInstanceOf(EmptyCapabilitySetException.class);
    }

    @Test
    public void explicitCapabilities_limitProxySurface() {
        Object proxy = UiSafeProxyFactory.forCapabilities(view, List.of(Clickable.class), counting, view);

        assertThat(proxy).isInstanceOf(Clickable.class).isNotInstanceOf(Typeable.class);
    }

    @Test
    public void constructionErrorsShareBaseType() {
        assertThat(new EmptyCapabilitySetException(null)).isInstanceOf(UiSafeException.class);
        assertThat(new InvalidCapabilityException(null, "x")).isInstanceOf(UiSafeException.class);
    }
}
