package com.example.iam.policy.rule;

import com.example.iam.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CidrBlock")
class CidrBlockTest {

    private static InetAddress address(String literal) {
        return CidrBlock.parseAddress(literal).orElseThrow();
    }

    @Test
    @DisplayName("should match addresses inside an IPv4 block")
    void shouldMatchIpv4() {
        CidrBlock block = CidrBlock.parse("10.0.0.0/8");

        assertThat(block.contains(address("10.255.1.2"))).isTrue();
        assertThat(block.contains(address("11.0.0.1"))).isFalse();
    }

    @Test
    @DisplayName("should handle prefixes that do not fall on a byte boundary")
    void shouldHandlePartialBytes() {
        CidrBlock block = CidrBlock.parse("172.16.0.0/12");

        assertThat(block.contains(address("172.31.255.255"))).isTrue();
        assertThat(block.contains(address("172.32.0.0"))).isFalse();
    }

    @Test
    @DisplayName("should treat a bare address as a single-host block")
    void shouldTreatBareAddressAsHost() {
        CidrBlock block = CidrBlock.parse("192.168.1.10");

        assertThat(block.contains(address("192.168.1.10"))).isTrue();
        assertThat(block.contains(address("192.168.1.11"))).isFalse();
    }

    @Test
    @DisplayName("should match IPv6 blocks and never mix address families")
    void shouldMatchIpv6() {
        CidrBlock block = CidrBlock.parse("2001:db8::/32");

        assertThat(block.contains(address("2001:db8:1::1"))).isTrue();
        assertThat(block.contains(address("10.0.0.1"))).isFalse();
    }

    @Test
    @DisplayName("should reject malformed notation")
    void shouldRejectMalformed() {
        assertThatThrownBy(() -> CidrBlock.parse("10.0.0.0/33")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> CidrBlock.parse("10.0.0.0/x")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> CidrBlock.parse("corp-network")).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("should not resolve host names")
    void shouldNotResolveHostNames() {
        assertThat(CidrBlock.parseAddress("localhost")).isEmpty();
    }

    @Test
    @DisplayName("should reject dotted quads with an octet above 255")
    void shouldRejectOutOfRangeOctets() {
        assertThat(CidrBlock.parseAddress("999.1.1.1")).isEmpty();
        assertThat(CidrBlock.parseAddress("10.0.0.256")).isEmpty();
        assertThatThrownBy(() -> CidrBlock.parse("300.0.0.0/8")).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("should reject malformed IPv6 text without a lookup")
    void shouldRejectMalformedIpv6() {
        assertThat(CidrBlock.parseAddress("2001:db8::zz")).isEmpty();
        assertThat(CidrBlock.parseAddress("fe80::1%eth0")).isEmpty();
        assertThat(CidrBlock.parseAddress("abc:def")).isEmpty();
    }

    @Test
    @DisplayName("should keep leading zeros and edge octets")
    void shouldParseEdgeOctets() {
        assertThat(address("255.255.255.255").getAddress()).containsExactly((byte) 255, (byte) 255, (byte) 255, (byte) 255);
        assertThat(address("010.000.000.001").getHostAddress()).isEqualTo("10.0.0.1");
    }
}
