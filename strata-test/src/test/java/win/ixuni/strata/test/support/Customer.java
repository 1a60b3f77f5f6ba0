package win.ixuni.strata.test.support;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import win.ixuni.strata.core.model.EntityType;
import win.ixuni.strata.core.model.StoredEntity;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class Customer extends StoredEntity {

    public static final EntityType<Customer> TYPE = EntityType.builder(Customer.class)
            .collectionName("customers")
            .defaultValue("tier", Customer::getTier, Customer::setTier, () -> Tier.STANDARD)
            .defaultValue("tags", Customer::getTags, Customer::setTags, ArrayList::new)
            .build();

    private String name;

    private String email;

    private Tier tier;

    private List<String> tags;

    public Customer(String id, String name, String email) {
        setId(id);
        this.name = name;
        this.email = email;
    }

    public enum Tier {
        STANDARD, GOLD
    }
}
