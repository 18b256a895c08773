package com.arth.workq.broker.dispatch;

import com.arth.workq.broker.delivery.ConsumerRegistration;
import com.arth.workq.broker.queue.MessageQueue;
import com.arth.workq.broker.queue.QueuedMessage;
import com.arth.workq.common.constant.LoggerName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Hands pending messages to eligible consumers in round-robin order until either the
 * queue is empty or no consumer has spare prefetch capacity.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(LoggerName.DELIVERY);

    private final String queueName;
    private final RoundRobinSelector<ConsumerRegistration> selector = new RoundRobinSelector<>();

    public Dispatcher(String queueName) {
        this.queueName = queueName;
    }

    /**
     * Must be called with the queue's lock held.
     *
     * @param deliverable which pending messages may be handed out now
     * @param eligible    whether a consumer can take one more message
     * @param sink        performs the delivery of a message removed from the queue
     * @return number of messages delivered
     */
    public int dispatch(MessageQueue pending,
                        List<ConsumerRegistration> consumers,
                        Predicate<QueuedMessage> deliverable,
                        Predicate<ConsumerRegistration> eligible,
                        BiConsumer<ConsumerRegistration, QueuedMessage> sink) {
        int delivered = 0;
        while (!pending.isEmpty() && !consumers.isEmpty()) {
            QueuedMessage next = pending.peekNext(deliverable);
            if (next == null) {
                break;
            }
            ConsumerRegistration consumer = selector.next(consumers, eligible);
            if (consumer == null) {
                break;
            }
            pending.remove(next);
            sink.accept(consumer, next);
            delivered++;
        }
        if (delivered > 0) {
            log.debug("Queue {}: dispatched {} messages, {} still pending", queueName, delivered, pending.size());
        }
        return delivered;
    }
}
