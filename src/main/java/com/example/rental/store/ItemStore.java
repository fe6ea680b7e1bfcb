package com.example.rental.store;

import com.example.rental.model.BookingStatus;
import com.example.rental.model.Item;
import com.example.rental.repository.BookingRepository;
import com.example.rental.repository.ItemRepository;
import com.example.rental.service.exception.NotFoundException;
import com.example.rental.service.exception.ValidationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Component
public class ItemStore extends AbstractStore {

    private final ItemRepository itemRepo;
    private final BookingRepository bookingRepo;

    public ItemStore(ItemRepository itemRepo, BookingRepository bookingRepo,
                     PlatformTransactionManager txManager, Clock clock) {
        super(txManager, clock);
        this.itemRepo = itemRepo;
        this.bookingRepo = bookingRepo;
    }

    /** New active item placed after every other active item. */
    public Item createItem(String name, String description, int totalQuantity) {
        return write("createItem", () -> {
            if (itemRepo.findFirstByNameIgnoreCaseAndActiveTrue(name).isPresent()) {
                throw new ValidationException("Аппарат «" + name + "» уже существует.");
            }
            LocalDateTime now = now();
            Item item = new Item();
            item.setName(name);
            item.setDescription(description);
            item.setTotalQuantity(totalQuantity);
            item.setSortOrder(itemRepo.findMaxSortOrder() + 1);
            item.setActive(true);
            item.setCreatedAt(now);
            item.setUpdatedAt(now);
            return itemRepo.save(item);
        });
    }

    /**
     * Changes name, description and capacity. A capacity below the busiest future day is
     * rejected. The item row is locked so no booking can slip in between check and update.
     */
    public Item updateItem(Long id, String name, String description, int totalQuantity) {
        return write("updateItem", () -> {
            Item item = itemRepo.findByIdForUpdate(id).orElseThrow(() -> new NotFoundException("Item", id));
            if (totalQuantity < item.getTotalQuantity()) {
                List<Long> counts = bookingRepo.findDailyCountsDesc(id, LocalDate.now(clock), BookingStatus.ACTIVE);
                long busiest = counts.isEmpty() ? 0 : counts.get(0);
                if (busiest > totalQuantity) {
                    throw new ValidationException(
                            "Нельзя уменьшить количество до %d: на одну из дат уже %d активных заявок."
                                    .formatted(totalQuantity, busiest));
                }
            }
            if (name != null && !name.equalsIgnoreCase(item.getName())) {
                itemRepo.findFirstByNameIgnoreCaseAndActiveTrue(name).ifPresent(other -> {
                    throw new ValidationException("Аппарат «" + name + "» уже существует.");
                });
                item.setName(name);
            }
            if (description != null) {
                item.setDescription(description);
            }
            item.setTotalQuantity(totalQuantity);
            item.setUpdatedAt(now());
            return itemRepo.save(item);
        });
    }

    public Item deactivateItem(Long id) {
        return write("deactivateItem", () -> {
            Item item = itemRepo.findById(id).orElseThrow(() -> new NotFoundException("Item", id));
            item.setActive(false);
            item.setUpdatedAt(now());
            return itemRepo.save(item);
        });
    }

    public Item reorderItem(Long id, int newOrder) {
        return write("reorderItem", () -> {
            Item item = itemRepo.findById(id).orElseThrow(() -> new NotFoundException("Item", id));
            item.setSortOrder(Math.max(newOrder, 1));
            item.setUpdatedAt(now());
            return itemRepo.save(item);
        });
    }

    public Optional<Item> getItemById(Long id) {
        return read("getItemById", () -> itemRepo.findById(id));
    }

    /** Active item with that name, case-insensitive. */
    public Optional<Item> getItemByName(String name) {
        return read("getItemByName", () -> itemRepo.findFirstByNameIgnoreCaseAndActiveTrue(name));
    }

    /** Sorted by sort order, then name. */
    public List<Item> listActiveItemsSorted() {
        return read("listActiveItemsSorted", itemRepo::findByActiveTrueOrderBySortOrderAscNameAsc);
    }
}
