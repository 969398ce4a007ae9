package com.plainer.collab.client.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ConnectionStateMachineTest {

    private final ConnectionStateMachine machine = new ConnectionStateMachine();

    @Test
    void happyPathThroughReconnection() {
        assertThat(machine.beginConnect().status()).isEqualTo(ConnectionStatus.CONNECTING);
        assertThat(machine.handshakeAccepted().status()).isEqualTo(ConnectionStatus.CONNECTED);

        StatusChange lost = machine.connectionLost("reset");
        assertThat(lost.status()).isEqualTo(ConnectionStatus.RECONNECTING);
        assertThat(lost.previous()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(lost.attempt()).isEqualTo(1);
        assertThat(machine.connectionLost("refused").attempt()).isEqualTo(2);

        StatusChange back = machine.handshakeAccepted();
        assertThat(back.previous()).isEqualTo(ConnectionStatus.RECONNECTING);
        assertThat(machine.attempt()).isZero();
    }

    @Test
    void exhaustionIsTerminal() {
        machine.beginConnect();
        machine.connectionLost("refused");

        StatusChange change = machine.retriesExhausted();

        assertThat(change.isTerminal()).isTrue();
        assertThat(change.error()).isEqualTo(ConnectionStateMachine.RETRIES_EXHAUSTED);
        assertThat(machine.status()).isEqualTo(ConnectionStatus.DISCONNECTED);
        assertThat(machine.attempt()).isZero();
    }

    @Test
    void rejectionOnlyDuringHandshake() {
        machine.beginConnect();
        machine.handshakeAccepted();

        assertThatThrownBy(() -> machine.handshakeRejected("denied")).isInstanceOf(IllegalStateException.class);
        assertThat(machine.sessionEnded("kicked").isTerminal()).isTrue();
    }

    @Test
    void invalidTransitionsThrow() {
        assertThatThrownBy(machine::handshakeAccepted).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(machine::closeRequested).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(machine::retriesExhausted).isInstanceOf(IllegalStateException.class);

        machine.beginConnect();
        assertThatThrownBy(machine::beginConnect).isInstanceOf(IllegalStateException.class);
        assertThat(machine.closeRequested().error()).isNull();
    }
}
