package uz.sonic.continuum.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uz.sonic.continuum.entity.AppUser;

import java.util.Optional;

public interface UserRepository extends JpaRepository<AppUser, Long> {

    Optional<AppUser> findFirstByEmailIgnoreCase(String email);
}
