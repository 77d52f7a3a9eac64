package lab.relay.domain.withdrawal;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WithdrawalRepository extends JpaRepository<Withdrawal, UUID> {
    List<Withdrawal> findByStatusOrderByCreatedAtAsc(WithdrawalStatus status);
}
