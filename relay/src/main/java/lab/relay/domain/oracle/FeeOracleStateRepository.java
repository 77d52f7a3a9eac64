package lab.relay.domain.oracle;

import org.springframework.data.jpa.repository.JpaRepository;

public interface FeeOracleStateRepository extends JpaRepository<FeeOracleState, Long> {
}
