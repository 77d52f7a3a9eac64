package lab.relay.domain.deposit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DepositRepository extends JpaRepository<Deposit, String> {
    Optional<Deposit> findBySourceTxId(String sourceTxId);

    List<Deposit> findByStatusOrderByFirstSeenAtAsc(DepositStatus status);
}
