package com.traders.marketstream.client;

import com.traders.marketstream.exception.SubscriptionRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.traders.marketstream.client.DomCapabilityResolverTest.json;
import static org.junit.jupiter.api.Assertions.*;

class SubscriptionAcksTest {

    @Test
    @DisplayName("Topics keep wire order and skip blanks and non-strings")
    void topics() {
        List<String> topics = SubscriptionAcks.topics(json("{'topics':[' market.bar-ES ',1,'','market.bar-ES','market.ticker-ES']}"));
        assertEquals(List.of("market.bar-ES", "market.bar-ES", "market.ticker-ES"), topics);
        assertEquals(List.of("market.bar-ES", "market.ticker-ES"), SubscriptionAcks.distinct(topics));
        assertTrue(SubscriptionAcks.topics(json("{'topics':'market.bar-ES'}")).isEmpty());
    }

    @Nested
    @DisplayName("Subscription id")
    class SubscriptionId {

        @Test
        @DisplayName("Top level keys come first")
        void topLevel() {
            assertEquals("s-1", SubscriptionAcks.subscriptionId(json("{'subscription_id':'s-1','metadata':{'id':'m-1'}}")));
        }

        @Test
        @DisplayName("Falls back to metadata, snapshots and payload")
        void nestedLocations() {
            assertEquals("m-2", SubscriptionAcks.subscriptionId(json("{'metadata':{'subscription':{'id':'m-2'}}}")));
            assertEquals("s-3", SubscriptionAcks.subscriptionId(json("{'snapshots':{'subscriptionId':'s-3'}}")));
            assertEquals("p-4", SubscriptionAcks.subscriptionId(json("{'payload':{'id':'p-4'}}")));
            assertEquals("p-5", SubscriptionAcks.subscriptionId(
                    json("{'payload':{'snapshots':{'subscription':{'subscription_id':'p-5'}}}}")));
        }

        @Test
        @DisplayName("A bare top level id is not a subscription id")
        void bareIdIgnored() {
            assertNull(SubscriptionAcks.subscriptionId(json("{'id':42,'action':'subscribe'}")));
        }
    }

    @Test
    @DisplayName("Capabilities are found under the subscription record of the snapshots")
    void capabilities() {
        assertEquals("false", SubscriptionAcks.capabilities(
                json("{'snapshots':{'subscription':{'capabilities':{'dom':'false'}}}}")).get("dom").asText());
        assertNull(SubscriptionAcks.capabilities(json("{'capabilities':true}")));
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("Error strings and error records are read in order")
        void errorShapes() {
            assertEquals("denied", SubscriptionAcks.error(json("{'error':'denied'}")));
            assertEquals("no entitlement", SubscriptionAcks.error(json("{'error':{'detail':'no entitlement'}}")));
            assertEquals("unknown symbol", SubscriptionAcks.error(json("{'payload':{'error':{'message':'unknown symbol'}}}")));
        }

        @Test
        @DisplayName("Failure flags use the message or a default")
        void failureFlags() {
            assertEquals("rate limited", SubscriptionAcks.error(json("{'status':'error','message':'rate limited'}")));
            assertEquals(SubscriptionAcks.DEFAULT_REJECTION, SubscriptionAcks.error(json("{'ok':false}")));
            assertEquals(SubscriptionAcks.DEFAULT_REJECTION, SubscriptionAcks.error(json("{'success':false}")));
        }

        @Test
        @DisplayName("Accepted ACKs pass")
        void accepted() {
            assertNull(SubscriptionAcks.error(json("{'status':'ok','success':true,'error':null}")));
            assertDoesNotThrow(() -> SubscriptionAcks.requireAccepted(json("{'ok':true}")));
        }

        @Test
        @DisplayName("requireAccepted throws with the server message")
        void requireAcceptedThrows() {
            SubscriptionRejectedException e = assertThrows(SubscriptionRejectedException.class,
                    () -> SubscriptionAcks.requireAccepted(json("{'error':'denied'}")));
            assertEquals("denied", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Embedded snapshot")
    class Snapshot {

        @Test
        @DisplayName("Found under payload data")
        void payloadData() {
            assertEquals(1, SubscriptionAcks.snapshot(json("{'payload':{'data':{'snapshot':{'ticker':{'last':1}}}}}"))
                    .get("ticker").get("last").asInt());
        }

        @Test
        @DisplayName("The first record of a snapshots array wins")
        void snapshotsArray() {
            assertTrue(SubscriptionAcks.snapshot(json("{'snapshots':[1,{'ticker':{}},{'depth':{}}]}")).has("ticker"));
        }

        @Test
        @DisplayName("Absent snapshot yields null")
        void absent() {
            assertNull(SubscriptionAcks.snapshot(json("{'snapshot':null,'data':{}}")));
        }
    }
}
