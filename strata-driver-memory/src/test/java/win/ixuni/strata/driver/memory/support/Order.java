package win.ixuni.strata.driver.memory.support;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import win.ixuni.strata.core.model.EntityType;
import win.ixuni.strata.core.model.StoredEntity;

@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class Order extends StoredEntity {

    public static final EntityType<Order> TYPE = EntityType.builder(Order.class)
            .collectionName("orders")
            .defaultValue("currency", Order::getCurrency, Order::setCurrency, () -> "EUR")
            .build();

    private String customer;

    private Long amount;

    private String currency;

    public Order(String id, String customer, long amount) {
        setId(id);
        this.customer = customer;
        this.amount = amount;
    }
}
