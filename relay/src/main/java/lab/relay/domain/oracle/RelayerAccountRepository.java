package lab.relay.domain.oracle;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RelayerAccountRepository extends JpaRepository<RelayerAccount, String> {
}
