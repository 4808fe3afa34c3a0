package com.mktsim.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NotificationTest {

    @Test
    void testExecutedCarriesFillOnACopy() {
        Order bid = Order.limit(1, 0, "ABM", Side.BUY, 10, 100, 3, null);

        Notification n = Notification.executed(bid, 99, 4);

        assertEquals(NotificationKind.EXECUTED, n.kind());
        assertEquals(3, n.orderId());
        assertEquals(4, n.order().quantity);
        assertEquals(99L, n.order().fillPrice);
        assertEquals(99L, n.fillPrice());
        assertNull(bid.fillPrice, "Original order untouched");
        assertEquals(10, bid.quantity);
    }

    @Test
    void testRejectedCarriesReason() {
        Order ask = Order.limit(1, 0, "ABM", Side.SELL, 10, 100, 3, null);

        Notification n = Notification.rejected(ask, 10, RejectReason.ORDER_NOT_FOUND);

        assertEquals(NotificationKind.REJECTED, n.kind());
        assertEquals(RejectReason.ORDER_NOT_FOUND, n.reason());
        assertNull(n.fillPrice());
        assertNotSame(ask, n.order());
    }
}
