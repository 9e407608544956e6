package defi.protocol.orderbook.service;

import defi.protocol.orderbook.domain.PairKey;
import defi.protocol.orderbook.exception.InvalidPairException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Order Hash Service Tests")
class OrderHashServiceTest {

    private static final String LOW = "0x0000000000000000000000000000000000000010";
    private static final String HIGH = "0xf000000000000000000000000000000000000000";
    private static final String MAKER = "0x00000000000000000000000000000000000a11ce";

    private final OrderHashService hashService = new OrderHashService();

    @Test
    @DisplayName("Pair key is keccak256 of both addresses packed, lower address first")
    void testPairKeyPacking() {
        String expected = Numeric.toHexString(Hash.sha3(
                Numeric.hexStringToByteArray(LOW.substring(2) + HIGH.substring(2))));

        assertThat(hashService.pairKey(LOW, HIGH)).isEqualTo(expected);
        assertThat(expected).hasSize(66);
    }

    @Test
    @DisplayName("Canonical key does not depend on argument order")
    void testCanonicalKeyIsSymmetric() {
        OrderBookIndex index = new OrderBookIndex();
        ReflectionTestUtils.setField(index, "orderHashService", hashService);

        PairKey ab = index.canonicalKey(LOW, HIGH);
        PairKey ba = index.canonicalKey(HIGH, LOW);

        assertThat(ab).isEqualTo(ba);
        assertThat(ab.getToken0()).isEqualTo(LOW);
        assertThat(ab.getToken1()).isEqualTo(HIGH);
    }

    @Test
    @DisplayName("Same token on both sides is rejected")
    void testSameTokenRejected() {
        OrderBookIndex index = new OrderBookIndex();
        ReflectionTestUtils.setField(index, "orderHashService", hashService);

        assertThatThrownBy(() -> index.canonicalKey(LOW, LOW)).isInstanceOf(InvalidPairException.class);
    }

    @Test
    @DisplayName("Identical orders at different creation times get different ids")
    void testOrderIdDependsOnCreationTime() {
        String first = hashService.orderId(MAKER, LOW, HIGH, BigInteger.TEN, BigInteger.ONE, 1000L);
        String again = hashService.orderId(MAKER, LOW, HIGH, BigInteger.TEN, BigInteger.ONE, 1000L);
        String later = hashService.orderId(MAKER, LOW, HIGH, BigInteger.TEN, BigInteger.ONE, 1001L);

        assertThat(first).isEqualTo(again);
        assertThat(first).isNotEqualTo(later);
        assertThat(first).startsWith("0x").hasSize(66);
    }
}
